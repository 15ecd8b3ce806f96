package com.solstice.formulac.compiler.analysis;

import com.solstice.formulac.compiler.config.CompilerConfig;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Recovers variable and parameter references from one formula body.
 *
 * <p>Works in two passes over the tokenized statements. The first pass builds
 * the alias table from bindings such as {@code p = parameters(period).gov.tax};
 * the second walks every statement and records entity calls, aggregation
 * lists, parameter chains (direct or through an alias) and conditional calls.
 *
 * <p>When tokenization fails the analyzer falls back to {@link #scanPatterns(String)},
 * a regex scan over the raw text that recovers the same categories as well as
 * it can. {@link #analyze(String)} never throws.
 */
public class FormulaAnalyzer {

    private static final Logger logger = Logger.getLogger(FormulaAnalyzer.class.getName());

    static final Pattern CANDIDATE_NAME = Pattern.compile("^[a-z_][a-z0-9_]*$");

    private static final String IDENT = "[A-Za-z_]\\w*";
    private static final Pattern QUOTED_NAME = Pattern.compile("['\"](" + IDENT + ")['\"]");
    private static final Pattern ADD_CALL = Pattern.compile("(?<![\\w.])add\\s*\\(");
    private static final Pattern LITERAL_LIST = Pattern.compile("\\[([^\\[\\]]*)]");
    private static final Pattern STRING_LIST_BODY =
            Pattern.compile("\\s*['\"]\\w+['\"]\\s*(?:,\\s*['\"]\\w+['\"]\\s*)*,?\\s*");
    private static final Pattern PARAMETER_ROOT = Pattern.compile("(?<![\\w.])parameters\\s*\\(");
    private static final Pattern CHAIN = Pattern.compile("\\G((?:\\s*\\.\\s*" + IDENT + ")*)");
    private static final Pattern ALIAS_BINDING = Pattern.compile(
            "^[ \\t]*(" + IDENT + ")[ \\t]*=[ \\t]*(?=parameters\\s*\\(|" + IDENT + "\\s*\\.)", Pattern.MULTILINE);
    private static final Pattern WHERE_CALL = Pattern.compile("(?<![\\w.])(?:np\\.|numpy\\.)?where\\s*\\(");
    private static final Pattern DEF_HEADER = Pattern.compile("def\\s+\\w+\\s*\\(\\s*(" + IDENT + ")");

    private final CompilerConfig config;
    private final Pattern entityCallPattern;

    public FormulaAnalyzer(CompilerConfig config) {
        this.config = config;
        String accessors = new LinkedHashSet<>(config.getEntityKeywords()).stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|")) + "|" + Pattern.quote(config.getMemberAccessor());
        this.entityCallPattern = Pattern.compile(
                "(?<![\\w.])((?:" + IDENT + "\\.)*)(" + accessors + ")\\s*\\(");
    }

    /**
     * Extracts the references of a formula. Blank input yields an empty set.
     */
    public ReferenceSet analyze(String formula) {
        if (formula == null || formula.isBlank()) {
            return ReferenceSet.empty(config.getDefaultEntity());
        }
        FormulaSource source;
        try {
            source = FormulaSource.parse(formula);
        } catch (FormulaSyntaxException e) {
            logger.fine("Structural parse failed at offset " + e.getOffset() + ": " + e.getMessage()
                    + "; scanning patterns instead");
            return scanPatterns(formula);
        }
        return analyzeStatements(source);
    }

    // ========================================================================
    // STRUCTURAL ANALYSIS
    // ========================================================================

    private ReferenceSet analyzeStatements(FormulaSource source) {
        Map<String, String> aliases = new LinkedHashMap<>();
        Set<Integer> bindingStatements = new HashSet<>();
        List<FormulaSource.Statement> statements = source.getStatements();

        // Pass 1: alias table
        for (int s = 0; s < statements.size(); s++) {
            String prefix = aliasPrefix(statements.get(s).tokens(), aliases);
            if (prefix != null) {
                aliases.put(statements.get(s).assignedName(), prefix);
                bindingStatements.add(s);
            }
        }

        Collector out = new Collector();
        for (int s = 0; s < statements.size(); s++) {
            List<Token> tokens = statements.get(s).tokens();
            boolean binding = bindingStatements.contains(s);
            for (int i = 0; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                if (!t.isName()) continue;
                boolean member = i > 0 && tokens.get(i - 1).is(".");
                boolean called = i + 1 < tokens.size() && tokens.get(i + 1).is("(");

                if (called && isEntityAccessor(t.text(), member)) {
                    List<List<Token>> args = FormulaSource.splitArguments(tokens, i + 1);
                    if (args.size() >= 2 && args.get(0).size() == 1 && args.get(0).get(0).isString()) {
                        String name = args.get(0).get(0).value();
                        out.variables.add(name);
                        out.entityCalls.add(new ReferenceSet.EntityCall(t.text(), name));
                    }
                } else if (called && !member && t.text().equals("add")) {
                    List<List<Token>> args = FormulaSource.splitArguments(tokens, i + 1);
                    if (args.size() >= 3 && !args.get(2).isEmpty() && args.get(2).get(0).is("[")) {
                        for (Token item : args.get(2)) {
                            if (item.isString()) {
                                out.variables.add(item.value());
                                out.aggregation.add(item.value());
                            }
                        }
                    }
                } else if (called && !member && t.text().equals("parameters")) {
                    if (!binding) {
                        int close = FormulaSource.matchingClose(tokens, i + 1);
                        if (close > 0) {
                            out.addParameter(String.join(".", chain(tokens, close + 1)));
                        }
                    }
                } else if (called && t.text().equals("where") && isWhereReceiver(tokens, i)) {
                    int first = member ? i - 2 : i;
                    int close = FormulaSource.matchingClose(tokens, i + 1);
                    if (close > 0) {
                        out.conditionals.add(source.getText().substring(tokens.get(first).start(), tokens.get(close).end()));
                    }
                } else if (!member && !binding && aliases.containsKey(t.text()) && !isAssignmentTarget(tokens, i)) {
                    List<String> segments = chain(tokens, i + 1);
                    out.addParameter(join(aliases.get(t.text()), segments));
                }
            }
            collectListCandidates(tokens, out);
        }
        out.listCandidates.removeAll(out.variables);

        String entityType = source.getSignature().isEmpty()
                ? config.getDefaultEntity()
                : source.getSignature().get(0);
        return out.build(aliases, entityType, true);
    }

    /**
     * Path prefix bound by an alias statement, or null when the statement
     * binds no alias. Handles the root form, sub-paths, and aliases of aliases.
     */
    private static String aliasPrefix(List<Token> tokens, Map<String, String> aliases) {
        if (tokens.size() < 3 || !tokens.get(0).isName() || !tokens.get(1).is("=")) {
            return null;
        }
        Token head = tokens.get(2);
        int chainStart;
        String base;
        if (head.isName("parameters") && tokens.size() > 3 && tokens.get(3).is("(")) {
            int close = FormulaSource.matchingClose(tokens, 3);
            if (close < 0) return null;
            chainStart = close + 1;
            base = "";
        } else if (head.isName() && aliases.containsKey(head.text())) {
            chainStart = 3;
            base = aliases.get(head.text());
        } else {
            return null;
        }
        List<String> segments = chain(tokens, chainStart);
        // the chain must cover the whole right-hand side
        if (chainStart + segments.size() * 2 != tokens.size()) {
            return null;
        }
        return join(base, segments);
    }

    /**
     * Dotted segments starting at {@code from}. Stops before a called segment.
     */
    private static List<String> chain(List<Token> tokens, int from) {
        List<String> segments = new ArrayList<>();
        int i = from;
        while (i + 1 < tokens.size() && tokens.get(i).is(".") && tokens.get(i + 1).isName()) {
            if (i + 2 < tokens.size() && tokens.get(i + 2).is("(")) {
                break;
            }
            segments.add(tokens.get(i + 1).text());
            i += 2;
        }
        return segments;
    }

    private boolean isEntityAccessor(String name, boolean member) {
        if (config.isEntityKeyword(name)) return true;
        return member && name.equals(config.getMemberAccessor());
    }

    private static boolean isWhereReceiver(List<Token> tokens, int i) {
        if (i == 0 || !tokens.get(i - 1).is(".")) {
            return true;
        }
        if (i < 2) return false;
        Token receiver = tokens.get(i - 2);
        boolean qualified = receiver.isName("np") || receiver.isName("numpy");
        return qualified && (i < 3 || !tokens.get(i - 3).is("."));
    }

    private static boolean isAssignmentTarget(List<Token> tokens, int i) {
        return i == 0 && tokens.size() > 1 && tokens.get(1).is("=");
    }

    private static void collectListCandidates(List<Token> tokens, Collector out) {
        for (int i = 0; i < tokens.size(); i++) {
            if (!tokens.get(i).is("[")) continue;
            int close = FormulaSource.matchingClose(tokens, i);
            if (close <= i + 1) continue;
            List<String> names = new ArrayList<>();
            boolean literal = true;
            for (int j = i + 1; j < close && literal; j++) {
                Token item = tokens.get(j);
                boolean expectString = (j - i) % 2 == 1;
                if (expectString) {
                    literal = item.isString() && CANDIDATE_NAME.matcher(item.value()).matches();
                    if (literal) names.add(item.value());
                } else {
                    literal = item.is(",");
                }
            }
            if (literal) {
                out.listCandidates.addAll(names);
            }
        }
    }

    // ========================================================================
    // PATTERN-SCAN FALLBACK
    // ========================================================================

    /**
     * Best-effort reference recovery for text the lexer rejects.
     */
    public ReferenceSet scanPatterns(String formula) {
        Collector out = new Collector();

        Matcher m = entityCallPattern.matcher(formula);
        while (m.find()) {
            boolean chained = !m.group(1).isEmpty();
            if (!isEntityAccessor(m.group(2), chained)) continue;
            List<String> args = CallSites.arguments(formula, m.end() - 1);
            String name = args != null && args.size() >= 2 ? CallSites.stringLiteral(args.get(0)) : null;
            if (name != null) {
                out.variables.add(name);
                out.entityCalls.add(new ReferenceSet.EntityCall(m.group(2), name));
            }
        }

        m = ADD_CALL.matcher(formula);
        while (m.find()) {
            List<String> args = CallSites.arguments(formula, m.end() - 1);
            if (args != null && args.size() >= 3 && args.get(2).startsWith("[")) {
                Matcher names = QUOTED_NAME.matcher(args.get(2));
                while (names.find()) {
                    out.variables.add(names.group(1));
                    out.aggregation.add(names.group(1));
                }
            }
        }

        m = LITERAL_LIST.matcher(formula);
        while (m.find()) {
            if (!STRING_LIST_BODY.matcher(m.group(1)).matches()) continue;
            Matcher names = QUOTED_NAME.matcher(m.group(1));
            while (names.find()) {
                if (CANDIDATE_NAME.matcher(names.group(1)).matches()) {
                    out.listCandidates.add(names.group(1));
                }
            }
        }
        out.listCandidates.removeAll(out.variables);

        Map<String, String> aliases = new LinkedHashMap<>();
        List<int[]> bindingSpans = new ArrayList<>();
        m = ALIAS_BINDING.matcher(formula);
        while (m.find()) {
            int lineEnd = formula.indexOf('\n', m.end());
            String rhs = formula.substring(m.end(), lineEnd < 0 ? formula.length() : lineEnd).trim();
            String prefix = scanAliasPrefix(rhs, aliases);
            if (prefix != null) {
                aliases.put(m.group(1), prefix);
                bindingSpans.add(new int[]{m.start(), lineEnd < 0 ? formula.length() : lineEnd});
            }
        }

        m = PARAMETER_ROOT.matcher(formula);
        while (m.find()) {
            if (within(bindingSpans, m.start())) continue;
            int close = CallSites.closingBracket(formula, m.end() - 1);
            if (close > 0) {
                out.addParameter(String.join(".", scanChain(formula, close + 1)));
            }
        }
        for (Map.Entry<String, String> alias : aliases.entrySet()) {
            Matcher use = Pattern.compile("(?<![\\w.])" + Pattern.quote(alias.getKey()) + "(?!\\w)").matcher(formula);
            while (use.find()) {
                if (within(bindingSpans, use.start())) continue;
                out.addParameter(join(alias.getValue(), scanChain(formula, use.end())));
            }
        }

        m = WHERE_CALL.matcher(formula);
        while (m.find()) {
            int close = CallSites.closingBracket(formula, m.end() - 1);
            if (close > 0) {
                out.conditionals.add(formula.substring(m.start(), close + 1));
            }
        }

        Matcher header = DEF_HEADER.matcher(formula);
        String entityType = header.find() ? header.group(1) : config.getDefaultEntity();
        return out.build(aliases, entityType, false);
    }

    private static String scanAliasPrefix(String rhs, Map<String, String> aliases) {
        Matcher root = Pattern.compile("^parameters\\s*\\([^()]*\\)").matcher(rhs);
        String base;
        int from;
        if (root.find()) {
            base = "";
            from = root.end();
        } else {
            Matcher head = Pattern.compile("^(" + IDENT + ")").matcher(rhs);
            if (!head.find() || !aliases.containsKey(head.group(1))) return null;
            base = aliases.get(head.group(1));
            from = head.end();
            if (from == rhs.length()) return null;
        }
        Matcher rest = CHAIN.matcher(rhs);
        if (!rest.find(from) || rest.end() != rhs.length()) return null;
        List<String> segments = new ArrayList<>();
        for (String segment : rest.group(1).split("\\.")) {
            if (!segment.isBlank()) segments.add(segment.trim());
        }
        return join(base, segments);
    }

    /**
     * Dotted segments at {@code from}; a segment followed by {@code (} ends the chain before it.
     */
    private static List<String> scanChain(String text, int from) {
        Matcher rest = CHAIN.matcher(text);
        List<String> segments = new ArrayList<>();
        if (!rest.find(from)) return segments;
        for (String segment : rest.group(1).split("\\.")) {
            if (!segment.isBlank()) segments.add(segment.trim());
        }
        int after = rest.end();
        while (after < text.length() && Character.isWhitespace(text.charAt(after))) after++;
        if (!segments.isEmpty() && after < text.length() && text.charAt(after) == '(') {
            segments.remove(segments.size() - 1);
        }
        return segments;
    }

    private static boolean within(List<int[]> spans, int offset) {
        for (int[] span : spans) {
            if (offset >= span[0] && offset < span[1]) return true;
        }
        return false;
    }

    private static String join(String prefix, List<String> segments) {
        String tail = String.join(".", segments);
        if (prefix.isEmpty()) return tail;
        return tail.isEmpty() ? prefix : prefix + "." + tail;
    }

    /**
     * Mutable accumulator for one analysis run.
     */
    private static final class Collector {
        final Set<String> variables = new LinkedHashSet<>();
        final Set<String> parameters = new LinkedHashSet<>();
        final Set<String> aggregation = new LinkedHashSet<>();
        final Set<String> listCandidates = new LinkedHashSet<>();
        final List<String> conditionals = new ArrayList<>();
        final List<ReferenceSet.EntityCall> entityCalls = new ArrayList<>();

        void addParameter(String path) {
            if (!path.isEmpty()) parameters.add(path);
        }

        ReferenceSet build(Map<String, String> aliases, String entityType, boolean structural) {
            return new ReferenceSet(variables, parameters, aggregation, listCandidates, aliases,
                    conditionals, entityCalls, entityType, structural);
        }
    }
}
