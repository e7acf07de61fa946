/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.util.CollectionUtils;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Selects the ECS tags that are projected into target labels. Nothing is exported unless tags are opted in, either
 * by key or with the <code>*</code> wildcard. Tags in the reserved <code>aws:</code> namespace are never exported.
 */
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class TagExportConfig {
    public static final String ALL_TAGS = "*";
    public static final String RESERVED_TAG_PREFIX = "aws:";

    private Set<String> includeTags = new HashSet<>();
    private Set<String> excludeTags = new HashSet<>();
    private Set<String> includePatterns = new HashSet<>();
    private Set<String> excludePatterns = new HashSet<>();
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private Set<Pattern> _include = new HashSet<>();
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private Set<Pattern> _exclude = new HashSet<>();

    public void compile() {
        _include.clear();
        _exclude.clear();
        if (includePatterns != null) {
            includePatterns.forEach(pattern -> _include.add(Pattern.compile(pattern)));
        }
        if (excludePatterns != null) {
            excludePatterns.forEach(pattern -> _exclude.add(Pattern.compile(pattern)));
        }
    }

    @JsonIgnore
    public boolean isEnabled() {
        return !CollectionUtils.isEmpty(includeTags) || !CollectionUtils.isEmpty(includePatterns);
    }

    @JsonIgnore
    public boolean isAllTags() {
        return !CollectionUtils.isEmpty(includeTags) && includeTags.contains(ALL_TAGS);
    }

    public boolean shouldCaptureTag(String tagName) {
        if (tagName == null || isReserved(tagName)) {
            return false;
        }
        compileIfStale();

        boolean include = isAllTags() ||
                (!CollectionUtils.isEmpty(includeTags) && includeTags.contains(tagName)) ||
                (!CollectionUtils.isEmpty(includePatterns) &&
                        _include.stream().anyMatch(p -> p.matcher(tagName).matches()));
        if (!include) {
            return false;
        }

        if (!CollectionUtils.isEmpty(excludeTags) && excludeTags.contains(tagName)) {
            return false;
        }
        return CollectionUtils.isEmpty(excludePatterns) ||
                _exclude.stream().noneMatch(p -> p.matcher(tagName).matches());
    }

    private void compileIfStale() {
        int includeCount = includePatterns == null ? 0 : includePatterns.size();
        int excludeCount = excludePatterns == null ? 0 : excludePatterns.size();
        if (_include.size() != includeCount || _exclude.size() != excludeCount) {
            compile();
        }
    }

    public static boolean isReserved(String tagName) {
        return tagName.toLowerCase(Locale.ROOT).startsWith(RESERVED_TAG_PREFIX);
    }

    @JsonIgnore
    public Set<Pattern> get_include() {
        return _include;
    }

    @JsonIgnore
    public Set<Pattern> get_exclude() {
        return _exclude;
    }
}
