package com.tempeh.plugin.version;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version range expression as used in manifest {@code dependencies}, npm style.
 * <ul>
 *   <li>{@code 1.2.3}, {@code =1.2.3} exact</li>
 *   <li>{@code ^1.2.3} compatible: below the next major (below the next minor for 0.x, next patch for 0.0.x)</li>
 *   <li>{@code ~1.2.3} approximately: below the next minor</li>
 *   <li>{@code >}, {@code >=}, {@code <}, {@code <=} comparators</li>
 *   <li>{@code *}, {@code x}, {@code 1.x}, {@code 1.2.x}, {@code 1}, {@code 1.2} wildcards</li>
 *   <li>{@code 1.2.3 - 2.0.0} inclusive hyphen range</li>
 *   <li>space-separated comparators must all match; {@code ||} separates alternatives</li>
 * </ul>
 * A prerelease version only satisfies a comparator set that names a prerelease of the same
 * major.minor.patch, so {@code ^1.0.0} does not pull in {@code 2.0.0-beta}.
 */
public final class VersionRange {

    private static final Pattern OPERATOR = Pattern.compile("^(<=|>=|<|>|=|\\^|~)?(.*)$");
    private static final Pattern PARTIAL = Pattern.compile(
            "^v?(\\d+|[xX*])(?:\\.(\\d+|[xX*]))?(?:\\.(\\d+|[xX*]))?(?:-([0-9A-Za-z.-]+))?(?:\\+[0-9A-Za-z.-]+)?$");
    private static final Pattern HYPHEN = Pattern.compile("^(\\S+)\\s+-\\s+(\\S+)$");

    private final String expression;
    private final List<List<Comparator>> alternatives;

    private VersionRange(String expression, List<List<Comparator>> alternatives) {
        this.expression = expression;
        this.alternatives = alternatives;
    }

    /**
     * Parses a range expression.
     *
     * @throws IllegalArgumentException if the expression cannot be parsed
     */
    public static VersionRange parse(String expression) {
        Objects.requireNonNull(expression, "expression");
        String trimmed = expression.trim();
        List<List<Comparator>> alternatives = new ArrayList<>();
        for (String part : trimmed.split("\\|\\|", -1)) {
            alternatives.add(parseSet(part.trim(), expression));
        }
        return new VersionRange(trimmed, List.copyOf(alternatives));
    }

    public static boolean isValid(String expression) {
        if (expression == null) {
            return false;
        }
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public boolean isSatisfiedBy(SemanticVersion version) {
        Objects.requireNonNull(version, "version");
        for (List<Comparator> set : alternatives) {
            if (matchesSet(set, version)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesSet(List<Comparator> set, SemanticVersion version) {
        for (Comparator c : set) {
            if (!c.test(version)) {
                return false;
            }
        }
        if (!version.isPrerelease()) {
            return true;
        }
        for (Comparator c : set) {
            if (c.version.isPrerelease() && c.version.sameCore(version)) {
                return true;
            }
        }
        return false;
    }

    private static List<Comparator> parseSet(String set, String original) {
        List<Comparator> out = new ArrayList<>();
        if (set.isEmpty()) {
            return List.of();
        }
        Matcher hyphen = HYPHEN.matcher(set);
        if (hyphen.matches()) {
            Partial from = Partial.parse(hyphen.group(1), original);
            Partial to = Partial.parse(hyphen.group(2), original);
            if (from.major != null) {
                out.add(new Comparator(Op.GTE, from.floor()));
            }
            addUpperInclusive(out, to);
            return List.copyOf(out);
        }
        // ">= 1.2.3" is accepted as ">=1.2.3"
        String normalized = set.replaceAll("(<=|>=|<|>|=|\\^|~)\\s+", "$1");
        for (String token : normalized.split("\\s+")) {
            addToken(out, token, original);
        }
        return List.copyOf(out);
    }

    private static void addToken(List<Comparator> out, String token, String original) {
        Matcher m = OPERATOR.matcher(token);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid version range: " + original);
        }
        String op = m.group(1) != null ? m.group(1) : "";
        Partial p = Partial.parse(m.group(2), original);
        switch (op) {
            case "":
            case "=":
                if (p.isFull()) {
                    out.add(new Comparator(Op.EQ, p.floor()));
                } else if (p.major != null) {
                    out.add(new Comparator(Op.GTE, p.floor()));
                    out.add(new Comparator(Op.LT, p.nextAtWildcard()));
                }
                break;
            case "^":
                if (p.major == null) {
                    break;
                }
                out.add(new Comparator(Op.GTE, p.floor()));
                out.add(new Comparator(Op.LT, caretCeiling(p)));
                break;
            case "~":
                if (p.major == null) {
                    break;
                }
                out.add(new Comparator(Op.GTE, p.floor()));
                out.add(new Comparator(Op.LT, p.minor == null
                        ? SemanticVersion.of(p.major + 1, 0, 0)
                        : SemanticVersion.of(p.major, p.minor + 1, 0)));
                break;
            case ">":
                if (p.major == null) {
                    out.add(new Comparator(Op.LT, SemanticVersion.of(0, 0, 0)));
                } else if (p.isFull()) {
                    out.add(new Comparator(Op.GT, p.floor()));
                } else {
                    out.add(new Comparator(Op.GTE, p.nextAtWildcard()));
                }
                break;
            case ">=":
                if (p.major != null) {
                    out.add(new Comparator(Op.GTE, p.floor()));
                }
                break;
            case "<":
                if (p.major == null) {
                    out.add(new Comparator(Op.LT, SemanticVersion.of(0, 0, 0)));
                } else {
                    out.add(new Comparator(Op.LT, p.floor()));
                }
                break;
            case "<=":
                addUpperInclusive(out, p);
                break;
            default:
                throw new IllegalArgumentException("Invalid version range: " + original);
        }
    }

    private static void addUpperInclusive(List<Comparator> out, Partial p) {
        if (p.major == null) {
            return;
        }
        if (p.isFull()) {
            out.add(new Comparator(Op.LTE, p.floor()));
        } else {
            out.add(new Comparator(Op.LT, p.nextAtWildcard()));
        }
    }

    private static SemanticVersion caretCeiling(Partial p) {
        if (p.major > 0) {
            return SemanticVersion.of(p.major + 1, 0, 0);
        }
        if (p.minor == null) {
            return SemanticVersion.of(1, 0, 0);
        }
        if (p.minor > 0) {
            return SemanticVersion.of(0, p.minor + 1, 0);
        }
        if (p.patch == null) {
            return SemanticVersion.of(0, 1, 0);
        }
        return SemanticVersion.of(0, 0, p.patch + 1);
    }

    @Override
    public String toString() {
        return expression;
    }

    private enum Op { EQ, GT, GTE, LT, LTE }

    private static final class Comparator {
        private final Op op;
        private final SemanticVersion version;

        Comparator(Op op, SemanticVersion version) {
            this.op = op;
            this.version = version;
        }

        boolean test(SemanticVersion v) {
            int c = v.compareTo(version);
            switch (op) {
                case EQ: return c == 0;
                case GT: return c > 0;
                case GTE: return c >= 0;
                case LT: return c < 0;
                case LTE: return c <= 0;
                default: throw new IllegalStateException(op.name());
            }
        }
    }

    /** Version with optional trailing wildcards; a null field and everything after it is a wildcard. */
    private static final class Partial {
        private final Integer major;
        private final Integer minor;
        private final Integer patch;
        private final String prerelease;

        private Partial(Integer major, Integer minor, Integer patch, String prerelease) {
            this.major = major;
            this.minor = major == null ? null : minor;
            this.patch = this.minor == null ? null : patch;
            this.prerelease = this.patch == null ? null : prerelease;
        }

        static Partial parse(String text, String original) {
            Matcher m = PARTIAL.matcher(text.trim());
            if (!m.matches()) {
                throw new IllegalArgumentException("Invalid version range: " + original);
            }
            try {
                return new Partial(number(m.group(1)), number(m.group(2)), number(m.group(3)), m.group(4));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid version range: " + original, e);
            }
        }

        private static Integer number(String s) {
            if (s == null || "x".equalsIgnoreCase(s) || "*".equals(s)) {
                return null;
            }
            return Integer.parseInt(s);
        }

        boolean isFull() {
            return patch != null;
        }

        SemanticVersion floor() {
            return SemanticVersion.of(major, minor != null ? minor : 0, patch != null ? patch : 0, prerelease);
        }

        /** First version past the wildcard: 1.x becomes 2.0.0, 1.2.x becomes 1.3.0. */
        SemanticVersion nextAtWildcard() {
            if (minor == null) {
                return SemanticVersion.of(major + 1, 0, 0);
            }
            return SemanticVersion.of(major, minor + 1, 0);
        }
    }
}
