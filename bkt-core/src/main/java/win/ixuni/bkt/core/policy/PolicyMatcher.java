package win.ixuni.bkt.core.policy;

import java.util.Collection;

/**
 * Action / resource pattern matching
 * <p>
 * {@code *} matches everything, otherwise the match is exact, except that a pattern ending in
 * {@code *} matches every value starting with the literal text before the star. No path
 * normalization is applied.
 */
final class PolicyMatcher {

    private PolicyMatcher() {
    }

    static boolean matches(String pattern, String value) {
        if (pattern == null || value == null) {
            return false;
        }
        if ("*".equals(pattern) || pattern.equals(value)) {
            return true;
        }
        if (pattern.endsWith("*")) {
            return value.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return false;
    }

    static boolean anyMatches(Collection<String> patterns, String value) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (matches(pattern, value)) {
                return true;
            }
        }
        return false;
    }
}
