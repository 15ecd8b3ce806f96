/*
 * Copyright (c) 2025 Solstice Formula Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.solstice.formulac.compiler.synthesis;

import com.solstice.formulac.api.model.Diagnostic;
import com.solstice.formulac.api.model.GeneratedModule;
import com.solstice.formulac.api.model.GeneratedModule.Declaration;
import com.solstice.formulac.api.model.VariableInfo;
import com.solstice.formulac.compiler.analysis.FormulaAnalyzer;
import com.solstice.formulac.compiler.analysis.FormulaSource;
import com.solstice.formulac.compiler.analysis.FormulaSyntaxException;
import com.solstice.formulac.compiler.analysis.ReferenceSet;
import com.solstice.formulac.compiler.config.CompilerConfig;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared per-variable rewrite pipeline of the code synthesizers.
 *
 * <p>Every statement of a formula body goes through the same fixed sequence:
 * <ol>
 *   <li>parameter inlining (alias bindings whose paths all resolved are dropped)</li>
 *   <li>entity-call rewriting</li>
 *   <li>aggregation rewriting</li>
 *   <li>{@link #finish(String)}, the backend's own formatting</li>
 * </ol>
 * The terminal {@code return} expression becomes the variable's declaration;
 * the statements before it are kept as intermediate steps. Subclasses only
 * decide how a module is laid out.
 */
public abstract class AbstractModuleSynthesizer implements CodeSynthesizer {

    private static final Logger logger = Logger.getLogger(AbstractModuleSynthesizer.class.getName());

    private static final Pattern ASSIGNMENT = Pattern.compile("^([A-Za-z_]\\w*)\\s*=(?!=)\\s*(.*)$", Pattern.DOTALL);

    protected final CompilerConfig config;
    protected final LiteralFormatter literals;
    private final FormulaAnalyzer analyzer;
    private final ParameterInliner inliner;
    private final EntityCallRewriter entityCalls;
    private final AggregationRewriter aggregations;

    protected AbstractModuleSynthesizer(CompilerConfig config, LiteralFormatter literals,
                                        EntityCallRewriter entityCalls, AggregationRewriter aggregations) {
        this.config = config;
        this.literals = literals;
        this.analyzer = new FormulaAnalyzer(config);
        this.inliner = new ParameterInliner(literals);
        this.entityCalls = entityCalls;
        this.aggregations = aggregations;
    }

    @Override
    public GeneratedModule synthesize(SynthesisRequest request) {
        List<String> inputs = new ArrayList<>();
        List<VariableInfo> computed = new ArrayList<>();
        for (String name : request.order()) {
            VariableInfo info = request.graph().getVariable(name);
            if (info == null) {
                continue;
            }
            if (info.isInput() || info.formulaSource().isBlank()) {
                inputs.add(name);
            } else {
                computed.add(info);
            }
        }

        Set<String> moduleNames = new LinkedHashSet<>(inputs);
        computed.forEach(info -> moduleNames.add(info.name()));

        List<Diagnostic> warnings = new ArrayList<>();
        List<Declaration> declarations = new ArrayList<>();
        for (VariableInfo info : computed) {
            declarations.add(declare(info, request, moduleNames, warnings));
        }

        String source = render(request, inputs, declarations);
        logger.fine("Synthesized " + language() + " module: " + inputs.size() + " inputs, "
                + declarations.size() + " declarations, " + warnings.size() + " warnings");
        return new GeneratedModule(language(), inputs, declarations, source, warnings);
    }

    /**
     * Lays out the final module text.
     */
    protected abstract String render(SynthesisRequest request, List<String> inputs, List<Declaration> declarations);

    /**
     * Backend formatting applied after the shared rewrites. Identity by default.
     */
    protected String finish(String text) {
        return text;
    }

    /**
     * Local names that must be renamed before rewriting, local to replacement.
     * None by default.
     */
    protected Map<String, String> localRenames(List<String> localNames, Set<String> moduleNames) {
        return Map.of();
    }

    private Declaration declare(VariableInfo info, SynthesisRequest request, Set<String> moduleNames,
                                List<Diagnostic> warnings) {
        String name = info.name();
        ReferenceSet refs = request.references().get(name);
        if (refs == null) {
            refs = analyzer.analyze(info.formulaSource());
        }
        Map<String, Object> table = request.parameters();

        List<String> unresolved = inliner.unresolved(refs.parameters(), table);
        for (String path : unresolved) {
            logger.warning("Parameter '" + path + "' used by '" + name + "' has no value, access left intact");
            warnings.add(new Diagnostic(Diagnostic.Kind.UNRESOLVED_PARAMETER, path,
                    "Parameter '" + path + "' used by '" + name + "' has no value; access left intact"));
        }

        Body body = Body.of(info.formulaSource());
        List<String> locals = new ArrayList<>();
        for (String statement : body.statements()) {
            Matcher m = ASSIGNMENT.matcher(statement);
            if (m.matches() && !refs.aliases().containsKey(m.group(1)) && !locals.contains(m.group(1))) {
                locals.add(m.group(1));
            }
        }
        Map<String, String> renames = localRenames(locals, moduleNames);

        List<String> statements = new ArrayList<>();
        for (String statement : body.statements()) {
            if (inliner.isRemovableBinding(statement, refs.aliases(), unresolved)) {
                continue;
            }
            String rewritten = rewrite(rename(statement, renames), refs, table);
            if (!isSelfAssignment(rewritten)) {
                statements.add(rewritten);
            }
        }
        String terminal = body.terminal() != null && !body.terminal().isBlank()
                ? rewrite(rename(body.terminal(), renames), refs, table)
                : literals.format(info.defaultValue());
        return new Declaration(name, statements, terminal);
    }

    private String rewrite(String text, ReferenceSet refs, Map<String, Object> table) {
        String out = inliner.inline(text, refs.aliases(), table);
        out = entityCalls.rewrite(out);
        out = aggregations.rewrite(out);
        return finish(out);
    }

    private static String rename(String text, Map<String, String> renames) {
        String out = text;
        for (Map.Entry<String, String> rename : renames.entrySet()) {
            out = CodeText.renameIdentifier(out, rename.getKey(), rename.getValue());
        }
        return out;
    }

    static boolean isSelfAssignment(String statement) {
        Matcher m = ASSIGNMENT.matcher(statement.trim());
        return m.matches() && m.group(1).equals(m.group(2).trim());
    }

    /**
     * Target name of a {@code name = expr} statement, or null.
     */
    static String assignedName(String statement) {
        Matcher m = ASSIGNMENT.matcher(statement.trim());
        return m.matches() ? m.group(1) : null;
    }

    /**
     * Formula body split into intermediate statements and the terminal expression.
     *
     * @param statements statements before the terminal one
     * @param terminal   result expression, or null for an empty body
     */
    record Body(List<String> statements, String terminal) {

        static Body of(String formula) {
            List<String> texts = new ArrayList<>();
            boolean returned = false;
            try {
                FormulaSource source = FormulaSource.parse(formula);
                int terminal = source.terminalIndex();
                for (int i = 0; i <= terminal; i++) {
                    FormulaSource.Statement statement = source.getStatements().get(i);
                    texts.add(statement.expression());
                    returned = statement.isReturn();
                }
            } catch (FormulaSyntaxException e) {
                logger.fine("Splitting unparseable formula by lines: " + e.getMessage());
                for (String line : formula.split("\n")) {
                    String trimmed = line.trim();
                    if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("@")
                            || trimmed.startsWith("def ")) {
                        continue;
                    }
                    if (trimmed.equals("return") || trimmed.startsWith("return ")) {
                        texts.add(trimmed.substring("return".length()).trim());
                        returned = true;
                        break;
                    }
                    texts.add(trimmed);
                }
            }
            if (texts.isEmpty()) {
                return new Body(List.of(), null);
            }
            String last = texts.get(texts.size() - 1);
            String target = returned ? null : assignedName(last);
            if (target != null) {
                // body ends in an assignment: the assigned name is the result
                return new Body(List.copyOf(texts), target);
            }
            return new Body(List.copyOf(texts.subList(0, texts.size() - 1)), last);
        }
    }
}
