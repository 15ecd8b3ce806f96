package com.solstice.formulac.compiler.synthesis;

import com.solstice.formulac.compiler.analysis.CallSites;

import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns {@code where(c, a, b)} calls (also {@code np.where}, {@code numpy.where})
 * into {@code ((c) ? (a) : (b))}.
 *
 * <p>After each replacement the scan resumes at the start of the replaced
 * site, so conditionals nested in any argument are flattened too. Sites that
 * do not have exactly three arguments, or are never closed, are left as they
 * are and skipped. Every iteration either removes one call or moves past it,
 * so the loop terminates.
 */
public class ConditionalFlattener {

    private static final Logger logger = Logger.getLogger(ConditionalFlattener.class.getName());

    private static final Pattern WHERE_CALL = Pattern.compile("(?<![\\w.])(?:np\\.|numpy\\.)?where\\s*\\(");

    public String flatten(String text) {
        String current = text;
        int from = 0;
        while (from < current.length()) {
            Matcher m = WHERE_CALL.matcher(current);
            if (!m.find(from)) {
                break;
            }
            int open = m.end() - 1;
            List<String> args = CodeText.insideString(current, m.start()) ? null : CallSites.arguments(current, open);
            if (args == null || args.size() != 3) {
                if (args != null) {
                    logger.fine("Leaving conditional with " + args.size() + " arguments unchanged");
                }
                from = m.end();
                continue;
            }
            int close = CallSites.closingBracket(current, open);
            String ternary = "((" + args.get(0) + ") ? (" + args.get(1) + ") : (" + args.get(2) + "))";
            current = current.substring(0, m.start()) + ternary + current.substring(close + 1);
            from = m.start();
        }
        return current;
    }
}
