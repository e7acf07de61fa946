/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.inventory;

import lombok.Getter;

/**
 * Tracks the <code>nextToken</code> of a paginated AWS list call. Stops when no token is returned or the same token
 * is returned twice in a row.
 */
@Getter
public class Paginator {
    private String lastToken;
    private String nextToken;

    public void nextToken(String newNextToken) {
        lastToken = nextToken;
        nextToken = newNextToken;
    }

    public boolean hasNext() {
        return nextToken != null && !nextToken.equalsIgnoreCase(lastToken);
    }
}
