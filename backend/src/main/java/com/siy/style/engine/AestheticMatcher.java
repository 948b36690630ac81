package com.siy.style.engine;

import com.siy.style.catalog.AestheticCompatibilityTable;
import com.siy.style.domain.AestheticStatus;
import com.siy.style.domain.CategoryL1;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class AestheticMatcher {

    static final double COHESIVE_MIN_OVERLAP = 0.25;

    /**
     * Jaccard index of two tag sets, compared case-insensitively. Two empty sets overlap fully.
     */
    public double overlap(Set<String> first, Set<String> second) {
        Set<String> a = normalize(first);
        Set<String> b = normalize(second);
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }

    public AestheticStatus statusFor(double overlap) {
        return overlap >= COHESIVE_MIN_OVERLAP ? AestheticStatus.COHESIVE : AestheticStatus.WARNING;
    }

    /**
     * An item without stated aesthetics is compatible with anything.
     */
    public AestheticStatus statusFor(Set<String> first, Set<String> second) {
        if (isEmpty(first) || isEmpty(second)) {
            return AestheticStatus.COHESIVE;
        }
        return statusFor(overlap(first, second));
    }

    /**
     * Share of the aesthetic penalty, in [0, 1]: none when either side is untagged,
     * otherwise the part of the union the two sets do not share.
     */
    public double penalty(Set<String> first, Set<String> second) {
        if (isEmpty(first) || isEmpty(second)) {
            return 0;
        }
        return 1 - overlap(first, second);
    }

    /**
     * The base tags followed by the tags the compatibility table pairs with them for the
     * target category, without case-insensitive duplicates.
     */
    public Set<String> suggestTags(Set<String> baseTags, CategoryL1 target) {
        Set<String> suggested = new LinkedHashSet<>();
        Set<String> seen = new HashSet<>();
        if (baseTags == null) {
            return suggested;
        }
        for (String tag : baseTags) {
            if (tag != null && !tag.isBlank() && seen.add(tag.trim().toLowerCase(Locale.ROOT))) {
                suggested.add(tag.trim());
            }
        }
        for (String tag : baseTags) {
            for (String compatible : AestheticCompatibilityTable.compatibleTags(target, tag)) {
                if (seen.add(compatible.toLowerCase(Locale.ROOT))) {
                    suggested.add(compatible);
                }
            }
        }
        return suggested;
    }

    private static boolean isEmpty(Set<String> tags) {
        return normalize(tags).isEmpty();
    }

    private static Set<String> normalize(Set<String> tags) {
        if (tags == null) {
            return Set.of();
        }
        return tags.stream()
            .filter(tag -> tag != null && !tag.isBlank())
            .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    }
}
