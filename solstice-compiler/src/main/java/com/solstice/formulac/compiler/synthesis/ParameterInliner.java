package com.solstice.formulac.compiler.synthesis;

import com.solstice.formulac.compiler.analysis.CallSites;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Replaces parameter accesses with their resolved literal values.
 *
 * <p>Handles the direct form {@code parameters(period).gov.tax.rate} and alias
 * chains {@code p.rate} where {@code p} was bound to a path prefix. Each access
 * is replaced as a whole: the chain is read to its end (stopping before a
 * called segment) and inlined only when that full path has a value, so a
 * shorter path never clobbers part of a longer one. Aliases are tried longest
 * name first. Accesses whose path has no value are left intact.
 */
public class ParameterInliner {

    private static final Pattern PARAMETER_ROOT = Pattern.compile("(?<![\\w.])parameters\\s*\\(");
    private static final Pattern SEGMENT = Pattern.compile("\\G\\s*\\.\\s*([A-Za-z_]\\w*)");
    private static final Pattern CALL_AHEAD = Pattern.compile("\\G\\s*\\(");

    private final LiteralFormatter literals;

    public ParameterInliner(LiteralFormatter literals) {
        this.literals = literals;
    }

    /**
     * Inlines every resolvable access in one statement.
     *
     * @param statement statement text
     * @param aliases   alias to path prefix
     * @param table     effective parameter table
     */
    public String inline(String statement, Map<String, String> aliases, Map<String, Object> table) {
        String text = inlineDirect(statement, table);
        if (!aliases.isEmpty()) {
            text = inlineAliases(text, aliases, table);
        }
        return text;
    }

    /**
     * True when {@code statement} only binds an alias ({@code p = parameters(period).gov}
     * or {@code q = p.tax}) and may be deleted because every path read through
     * that alias resolved.
     */
    public boolean isRemovableBinding(String statement, Map<String, String> aliases, List<String> unresolved) {
        Matcher m = Pattern.compile("^\\s*([A-Za-z_]\\w*)\\s*=\\s*(.+)$", Pattern.DOTALL).matcher(statement);
        if (!m.matches() || !aliases.containsKey(m.group(1))) {
            return false;
        }
        String rhs = m.group(2).trim();
        boolean binding = PARAMETER_ROOT.matcher(rhs).lookingAt();
        if (!binding) {
            Matcher head = Pattern.compile("^([A-Za-z_]\\w*)").matcher(rhs);
            binding = head.find() && aliases.containsKey(head.group(1));
        }
        if (!binding) {
            return false;
        }
        String prefix = aliases.get(m.group(1));
        return unresolved.stream().noneMatch(path ->
                prefix.isEmpty() || path.equals(prefix) || path.startsWith(prefix + "."));
    }

    /**
     * Paths read by a formula that have no value in {@code table}, in order.
     */
    public List<String> unresolved(Iterable<String> paths, Map<String, Object> table) {
        List<String> missing = new ArrayList<>();
        for (String path : paths) {
            if (!table.containsKey(path)) missing.add(path);
        }
        return missing;
    }

    private String inlineDirect(String text, Map<String, Object> table) {
        StringBuilder out = new StringBuilder();
        int copied = 0;
        Matcher m = PARAMETER_ROOT.matcher(text);
        int from = 0;
        while (from < text.length() && m.find(from)) {
            if (CodeText.insideString(text, m.start())) {
                from = m.end();
                continue;
            }
            int close = CallSites.closingBracket(text, m.end() - 1);
            if (close < 0) {
                break;
            }
            Chain chain = readChain(text, close + 1);
            if (!chain.segments.isEmpty() && table.containsKey(chain.path(""))) {
                out.append(text, copied, m.start()).append(literals.format(table.get(chain.path(""))));
                copied = chain.end;
            }
            from = Math.max(chain.end, m.end());
        }
        return out.append(text.substring(copied)).toString();
    }

    private String inlineAliases(String text, Map<String, String> aliases, Map<String, Object> table) {
        String names = aliases.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        Matcher m = Pattern.compile("(?<![\\w.])(" + names + ")(?!\\w)").matcher(text);
        StringBuilder out = new StringBuilder();
        int copied = 0;
        int from = 0;
        while (from < text.length() && m.find(from)) {
            if (CodeText.insideString(text, m.start()) || isAssignmentTarget(text, m.end())) {
                from = m.end();
                continue;
            }
            Chain chain = readChain(text, m.end());
            String path = chain.path(aliases.get(m.group(1)));
            if (!path.isEmpty() && table.containsKey(path)) {
                out.append(text, copied, m.start()).append(literals.format(table.get(path)));
                copied = chain.end;
            }
            from = Math.max(chain.end, m.end());
        }
        return out.append(text.substring(copied)).toString();
    }

    private static boolean isAssignmentTarget(String text, int end) {
        Matcher m = Pattern.compile("\\G\\s*=(?!=)").matcher(text);
        return m.find(end);
    }

    /**
     * Reads {@code .seg} repetitions from {@code from}, stopping before a segment
     * that is immediately called.
     */
    private static Chain readChain(String text, int from) {
        List<String> segments = new ArrayList<>();
        int end = from;
        Matcher seg = SEGMENT.matcher(text);
        while (seg.find(end)) {
            if (CALL_AHEAD.matcher(text).region(seg.end(), text.length()).lookingAt()) {
                break;
            }
            segments.add(seg.group(1));
            end = seg.end();
        }
        return new Chain(segments, end);
    }

    private record Chain(List<String> segments, int end) {
        String path(String prefix) {
            String tail = String.join(".", segments);
            if (prefix.isEmpty()) return tail;
            return tail.isEmpty() ? prefix : prefix + "." + tail;
        }
    }
}
