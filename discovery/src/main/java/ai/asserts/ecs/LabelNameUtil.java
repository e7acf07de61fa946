/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Turns arbitrary keys like ECS tag keys into Prometheus label names.
 */
@Component
public class LabelNameUtil {
    public static final String UNDERSCORE = "_";
    private static final Pattern INVALID_CHARACTERS = Pattern.compile("[^a-z0-9_]");

    public String toLabelName(String input) {
        return INVALID_CHARACTERS.matcher(toSnakeCase(input)).replaceAll(UNDERSCORE);
    }

    public String toSnakeCase(String input) {
        StringBuilder builder = new StringBuilder();
        boolean lastCaseWasSmall = false;
        int numContiguousUpperCase = 0;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);

            if (c == '-' || c == ':' || c == '/' || c == '.' || Character.isWhitespace(c)) {
                appendUnderscore(builder);
                numContiguousUpperCase = 0;
                lastCaseWasSmall = false;
                continue;
            } else if (Character.isUpperCase(c) && lastCaseWasSmall) {
                appendUnderscore(builder);
            } else if (Character.isLowerCase(c) && numContiguousUpperCase > 1) {
                char lastUpperCaseLetter = builder.charAt(builder.length() - 1);
                builder.deleteCharAt(builder.length() - 1);
                appendUnderscore(builder);
                builder.append(lastUpperCaseLetter);
            }
            builder.append(c);
            lastCaseWasSmall = Character.isLowerCase(c) || Character.isDigit(c);
            if (Character.isUpperCase(c)) {
                numContiguousUpperCase++;
            } else {
                numContiguousUpperCase = 0;
            }
        }
        return builder.toString().toLowerCase();
    }

    private void appendUnderscore(StringBuilder builder) {
        if (builder.length() > 0 && builder.charAt(builder.length() - 1) != '_') {
            builder.append(UNDERSCORE);
        }
    }
}
