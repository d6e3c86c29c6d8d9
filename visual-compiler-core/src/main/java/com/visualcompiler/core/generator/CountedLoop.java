package com.visualcompiler.core.generator;

import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A C-style for loop recognized as a counted range {@code [start, end)} over one variable.
 *
 * <p>Recognized shapes: {@code [type] i = <start>}, {@code i < <bound>} or
 * {@code i <= <bound>}, and {@code i++}, {@code ++i}, {@code i += 1} or {@code i = i + 1}.
 *
 * @param variable loop variable
 * @param start inclusive start expression
 * @param end exclusive end expression
 */
record CountedLoop(String variable, String start, String end) {

    private static final Pattern INIT = Pattern.compile("^\\s*(?:[A-Za-z_][\\w<>]*\\s+)?([A-Za-z_]\\w*)\\s*=\\s*(-?\\w+)\\s*$");
    private static final Pattern CONDITION = Pattern.compile("^\\s*([A-Za-z_]\\w*)\\s*(<=|<)\\s*(.+?)\\s*$");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern LEADING_ASSIGNMENT = Pattern.compile("^\\s*(?:[A-Za-z_][\\w<>]*\\s+)?([A-Za-z_]\\w*)\\s*=");

    /**
     * Tries to read a for-loop triple as a counted range.
     *
     * @param init initialization clause
     * @param condition loop condition
     * @param increment increment clause
     * @return the counted loop, or empty if the triple has another shape
     */
    static Optional<CountedLoop> recognize(String init, String condition, String increment) {
        Matcher initMatcher = INIT.matcher(init);
        Matcher conditionMatcher = CONDITION.matcher(condition);
        if (!initMatcher.matches() || !conditionMatcher.matches()) {
            return Optional.empty();
        }

        String variable = initMatcher.group(1);
        if (!variable.equals(conditionMatcher.group(1)) || !isUnitIncrement(variable, increment)) {
            return Optional.empty();
        }

        String bound = conditionMatcher.group(3);
        String end = bound;
        if ("<=".equals(conditionMatcher.group(2))) {
            end = INTEGER.matcher(bound).matches()
                ? new BigInteger(bound).add(BigInteger.ONE).toString()
                : bound + " + 1";
        }
        return Optional.of(new CountedLoop(variable, initMatcher.group(2), end));
    }

    /**
     * Returns the variable an initialization clause assigns, or {@code i}.
     *
     * @param init initialization clause
     * @return loop variable name
     */
    static String loopVariable(String init) {
        Matcher matcher = LEADING_ASSIGNMENT.matcher(init);
        return matcher.find() ? matcher.group(1) : "i";
    }

    private static boolean isUnitIncrement(String variable, String increment) {
        String compact = increment.replaceAll("\\s+", "");
        return compact.equals(variable + "++")
            || compact.equals("++" + variable)
            || compact.equals(variable + "+=1")
            || compact.equals(variable + "=" + variable + "+1");
    }
}
