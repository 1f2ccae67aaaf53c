package com.bot.plugin;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Version requirement on a dependency: {@code *} (any), {@code 1.2} or {@code ==1.2} (exact),
 * {@code >=1.2}, {@code >1.2}, {@code <=2}, {@code <2}; comma-separated clauses must all hold.
 * Versions compare segment by segment on {@code .} and {@code -}; numeric segments compare as
 * numbers, others as text, missing segments count as 0.
 */
public final class VersionConstraint {

    private enum Op {
        EQ("=="), GE(">="), LE("<="), GT(">"), LT("<");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }
    }

    private static final class Clause {
        private final Op op;
        private final String version;

        private Clause(Op op, String version) {
            this.op = op;
            this.version = version;
        }

        boolean test(String candidate) {
            int c = compare(candidate, version);
            switch (op) {
                case EQ: return c == 0;
                case GE: return c >= 0;
                case LE: return c <= 0;
                case GT: return c > 0;
                case LT: return c < 0;
                default: throw new IllegalStateException("Unhandled operator " + op);
            }
        }

        @Override
        public String toString() {
            return op.symbol + version;
        }
    }

    private final String text;
    private final List<Clause> clauses;

    private VersionConstraint(String text, List<Clause> clauses) {
        this.text = text;
        this.clauses = clauses;
    }

    /**
     * @throws IllegalArgumentException if a clause has an operator but no version
     */
    public static VersionConstraint parse(String text) {
        String t = text == null ? "" : text.trim();
        List<Clause> clauses = new ArrayList<>();
        if (!t.isEmpty() && !"*".equals(t)) {
            for (String part : t.split(",")) {
                String p = part.trim();
                if (p.isEmpty() || "*".equals(p)) {
                    continue;
                }
                Op op = Op.EQ;
                for (Op candidate : Op.values()) {
                    if (p.startsWith(candidate.symbol)) {
                        op = candidate;
                        p = p.substring(candidate.symbol.length()).trim();
                        break;
                    }
                }
                if (p.isEmpty()) {
                    throw new IllegalArgumentException("Version constraint '" + text + "' has an operator without a version");
                }
                clauses.add(new Clause(op, p));
            }
        }
        return new VersionConstraint(t.isEmpty() ? "*" : t, List.copyOf(clauses));
    }

    public boolean isSatisfiedBy(String version) {
        Objects.requireNonNull(version, "version");
        for (Clause clause : clauses) {
            if (!clause.test(version.trim())) {
                return false;
            }
        }
        return true;
    }

    /** Compares two version strings; negative when {@code a} is older. */
    static int compare(String a, String b) {
        String[] left = a.split("[.-]");
        String[] right = b.split("[.-]");
        int n = Math.max(left.length, right.length);
        for (int i = 0; i < n; i++) {
            String l = i < left.length ? left[i] : "0";
            String r = i < right.length ? right[i] : "0";
            int c;
            if (isNumeric(l) && isNumeric(r)) {
                c = new BigInteger(l).compareTo(new BigInteger(r));
            } else {
                c = l.compareTo(r);
            }
            if (c != 0) {
                return c;
            }
        }
        return 0;
    }

    private static boolean isNumeric(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return text;
    }
}
