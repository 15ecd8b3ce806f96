package com.solstice.formulac.compiler.synthesis;

import com.solstice.formulac.compiler.analysis.CallSites;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites group aggregations into target-language sums.
 *
 * <ul>
 *   <li>{@code household.sum(inner)} becomes {@code np.sum(inner)} (Python) or
 *       {@code [].concat(inner).reduce((s, v) => s + v, 0)} (JavaScript)</li>
 *   <li>{@code add(person, period, ["a", "b"])} becomes the parenthesized sum of
 *       the referenced values</li>
 * </ul>
 */
public class AggregationRewriter {

    private static final Pattern SUM_CALL = Pattern.compile("\\.sum\\s*\\(");
    private static final Pattern ADD_CALL = Pattern.compile("(?<![\\w.])add\\s*\\(");
    private static final Pattern QUOTED = Pattern.compile("^['\"]([A-Za-z_]\\w*)['\"]$");

    private final UnaryOperator<String> sum;
    private final UnaryOperator<String> reference;

    /**
     * @param sum       wraps the inner expression of a {@code .sum(...)} call
     * @param reference maps a variable name to its target-language reference
     */
    public AggregationRewriter(UnaryOperator<String> sum, UnaryOperator<String> reference) {
        this.sum = sum;
        this.reference = reference;
    }

    public static AggregationRewriter python() {
        return new AggregationRewriter(inner -> "np.sum(" + inner + ")", name -> "results['" + name + "']");
    }

    public static AggregationRewriter javascript() {
        return new AggregationRewriter(inner -> "[].concat(" + inner + ").reduce((s, v) => s + v, 0)",
                UnaryOperator.identity());
    }

    public String rewrite(String text) {
        return rewriteAdd(rewriteSum(text));
    }

    private String rewriteSum(String text) {
        String current = text;
        int from = 0;
        while (true) {
            Matcher m = SUM_CALL.matcher(current);
            if (!m.find(from)) {
                return current;
            }
            int start = CodeText.receiverStart(current, m.start());
            String receiver = current.substring(start, m.start());
            int open = m.end() - 1;
            int close = CallSites.closingBracket(current, open);
            if (close < 0 || receiver.isEmpty() || receiver.equals("np") || receiver.equals("numpy")
                    || CodeText.insideString(current, m.start())) {
                from = m.end();
                continue;
            }
            String inner = current.substring(open + 1, close).trim();
            String replacement = sum.apply(inner);
            current = current.substring(0, start) + replacement + current.substring(close + 1);
            // nested sums inside the inner expression are still ahead of this point
            from = start + replacement.indexOf(inner);
        }
    }

    private String rewriteAdd(String text) {
        StringBuilder out = new StringBuilder();
        Matcher m = ADD_CALL.matcher(text);
        int copied = 0;
        int from = 0;
        while (from < text.length() && m.find(from)) {
            from = m.end();
            if (CodeText.insideString(text, m.start())) continue;
            int open = m.end() - 1;
            List<String> args = CallSites.arguments(text, open);
            if (args == null || args.size() != 3 || !args.get(2).startsWith("[") || !args.get(2).endsWith("]")) {
                continue;
            }
            List<String> items = CallSites.arguments(args.get(2), 0);
            List<String> names = new ArrayList<>();
            for (String item : items) {
                Matcher q = QUOTED.matcher(item);
                if (!q.matches()) {
                    names = null;
                    break;
                }
                names.add(q.group(1));
            }
            if (names == null) continue;
            String replacement = names.isEmpty()
                    ? "0"
                    : names.stream().map(reference).collect(Collectors.joining(" + ", "(", ")"));
            int close = CallSites.closingBracket(text, open);
            out.append(text, copied, m.start()).append(replacement);
            copied = close + 1;
            from = close + 1;
        }
        return out.append(text.substring(copied)).toString();
    }
}
