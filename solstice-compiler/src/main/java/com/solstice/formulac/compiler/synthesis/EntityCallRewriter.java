package com.solstice.formulac.compiler.synthesis;

import com.solstice.formulac.compiler.analysis.CallSites;
import com.solstice.formulac.compiler.config.CompilerConfig;

import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Replaces entity calls with a reference to the computed value.
 *
 * <p>{@code person("income", period)}, {@code person.household("rent", period)} and
 * {@code household.members("age", period)} are replaced, receiver chain
 * included, by whatever the target backend uses to name a value. Receivers
 * may carry calls and subscripts, as in {@code f(x)[0].household("rent", period)}.
 */
public class EntityCallRewriter {

    private final CompilerConfig config;
    private final Pattern callPattern;
    private final UnaryOperator<String> reference;

    /**
     * @param reference maps a variable name to its target-language reference
     */
    public EntityCallRewriter(CompilerConfig config, UnaryOperator<String> reference) {
        this.config = config;
        this.reference = reference;
        String accessors = config.getEntityKeywords().stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|")) + "|" + Pattern.quote(config.getMemberAccessor());
        this.callPattern = Pattern.compile("(?<!\\w)((?:[A-Za-z_]\\w*\\s*\\.\\s*)*)(" + accessors + ")\\s*\\(");
    }

    public static EntityCallRewriter python(CompilerConfig config) {
        return new EntityCallRewriter(config, name -> "results['" + name + "']");
    }

    public static EntityCallRewriter javascript(CompilerConfig config) {
        return new EntityCallRewriter(config, UnaryOperator.identity());
    }

    public String rewrite(String text) {
        StringBuilder out = new StringBuilder();
        Matcher m = callPattern.matcher(text);
        int copied = 0;
        int from = 0;
        while (from < text.length() && m.find(from)) {
            from = m.end();
            int start = m.start();
            if (start > copied && text.charAt(start - 1) == '.') {
                start = CodeText.receiverStart(text, start - 1);
                // receiver overlaps a call already replaced
                if (start < copied) continue;
            }
            boolean chained = start < m.start() || !m.group(1).isEmpty();
            String accessor = m.group(2);
            if (CodeText.insideString(text, m.start())
                    || (!chained && !config.isEntityKeyword(accessor))) {
                continue;
            }
            int open = m.end() - 1;
            List<String> args = CallSites.arguments(text, open);
            String name = args != null && args.size() >= 2 ? CallSites.stringLiteral(args.get(0)) : null;
            if (name == null) {
                continue;
            }
            int close = CallSites.closingBracket(text, open);
            out.append(text, copied, start).append(reference.apply(name));
            copied = close + 1;
            from = close + 1;
        }
        return out.append(text.substring(copied)).toString();
    }
}
