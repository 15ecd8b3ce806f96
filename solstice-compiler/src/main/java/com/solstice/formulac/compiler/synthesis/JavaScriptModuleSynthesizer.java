/*
 * Copyright (c) 2025 Solstice Formula Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.solstice.formulac.compiler.synthesis;

import com.solstice.formulac.api.model.GeneratedModule.Declaration;
import com.solstice.formulac.api.model.ModuleFormat;
import com.solstice.formulac.api.model.TargetLanguage;
import com.solstice.formulac.api.model.VariableInfo;
import com.solstice.formulac.compiler.config.CompilerConfig;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Emits a JavaScript module, or a TypeScript one when annotations are on.
 *
 * <p>Each computed variable becomes a {@code const} in evaluation order. A
 * formula with intermediate statements is wrapped in an immediately invoked
 * arrow function whose locals are {@code let}-declared; locals that would
 * shadow a module value are renamed with a leading underscore. The entry
 * point takes one object so that callers pass named inputs:
 * <pre>
 * function calculate({ income = 0 } = {}) {
 *   const income_tax = income * 0.2;
 *   return {
 *     income,
 *     income_tax,
 *   };
 * }
 * </pre>
 * and is exported according to the {@link ModuleFormat}.
 */
public class JavaScriptModuleSynthesizer extends AbstractModuleSynthesizer {

    private static final Set<String> RESERVED = Set.of(
            "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
            "do", "else", "enum", "export", "extends", "false", "finally", "for", "function", "if",
            "import", "in", "instanceof", "let", "new", "null", "return", "super", "switch", "this",
            "throw", "true", "try", "typeof", "var", "void", "while", "with", "yield", "await",
            "arguments", "eval", "static", "implements", "interface", "package", "private",
            "protected", "public", "Math");

    private final boolean typescript;
    private final ConditionalFlattener flattener = new ConditionalFlattener();
    private final JavaScriptExpressionTranslator translator;

    public JavaScriptModuleSynthesizer(CompilerConfig config) {
        this(config, false);
    }

    public JavaScriptModuleSynthesizer(CompilerConfig config, boolean typescript) {
        super(config, LiteralFormatter.JAVASCRIPT, EntityCallRewriter.javascript(config), AggregationRewriter.javascript());
        this.typescript = typescript;
        this.translator = new JavaScriptExpressionTranslator(config);
    }

    @Override
    public TargetLanguage language() {
        return typescript ? TargetLanguage.TYPESCRIPT : TargetLanguage.JAVASCRIPT;
    }

    @Override
    protected String finish(String text) {
        return translator.translate(flattener.flatten(text));
    }

    @Override
    protected Map<String, String> localRenames(List<String> localNames, Set<String> moduleNames) {
        Map<String, String> renames = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>(moduleNames);
        taken.addAll(localNames);
        for (String local : localNames) {
            if (moduleNames.contains(local) || RESERVED.contains(local)) {
                String renamed = "_" + local;
                while (taken.contains(renamed)) {
                    renamed = "_" + renamed;
                }
                taken.add(renamed);
                renames.put(local, renamed);
            }
        }
        return renames;
    }

    @Override
    protected String render(SynthesisRequest request, List<String> inputs, List<Declaration> declarations) {
        ModuleFormat format = request.moduleFormat() != null ? request.moduleFormat() : config.getModuleFormat();
        boolean iife = format == ModuleFormat.IIFE;
        String indent = iife ? "  " : "";

        StringBuilder sb = new StringBuilder();
        sb.append("/**\n");
        sb.append(" * Calculation module generated by solstice-formula-compiler.\n");
        sb.append(" *\n");
        sb.append(" * Targets: ").append(String.join(", ", request.targets())).append('\n');
        sb.append(" * Parameters resolved at: ").append(request.instant()).append('\n');
        sb.append(" */\n");

        StringBuilder body = new StringBuilder();
        if (typescript) {
            renderInterfaces(body, request, inputs, declarations);
        }
        if (config.isIncludeJsDoc()) {
            renderJsDoc(body, request, inputs, declarations);
        }
        renderFunction(body, request, inputs, declarations);

        if (iife) {
            sb.append("(function (global) {\n");
            sb.append("  'use strict';\n\n");
            for (String line : body.toString().split("\n", -1)) {
                if (!line.isEmpty()) sb.append(indent).append(line);
                sb.append('\n');
            }
            sb.append("  global.calculate = calculate;\n");
            sb.append("})(typeof globalThis !== 'undefined' ? globalThis : this);\n");
            return sb.toString();
        }

        sb.append('\n').append(body);
        switch (format) {
            case ESM -> sb.append("\nexport { calculate };\nexport default calculate;\n");
            case COMMONJS -> sb.append("\nmodule.exports = { calculate };\n");
            default -> {
                // no export statement
            }
        }
        return sb.toString();
    }

    private void renderInterfaces(StringBuilder sb, SynthesisRequest request, List<String> inputs,
                                  List<Declaration> declarations) {
        sb.append("interface CalculationInputs {\n");
        for (String input : inputs) {
            sb.append("  ").append(input).append("?: ").append(tsType(request, input)).append(";\n");
        }
        sb.append("}\n\n");
        sb.append("interface CalculationResult {\n");
        for (String input : inputs) {
            sb.append("  ").append(input).append(": ").append(tsType(request, input)).append(";\n");
        }
        for (Declaration declaration : declarations) {
            sb.append("  ").append(declaration.name()).append(": ")
                    .append(tsType(request, declaration.name())).append(";\n");
        }
        sb.append("}\n\n");
    }

    private void renderJsDoc(StringBuilder sb, SynthesisRequest request, List<String> inputs,
                             List<Declaration> declarations) {
        sb.append("/**\n");
        sb.append(" * Computes ").append(String.join(", ", request.targets())).append(".\n");
        sb.append(" *\n");
        sb.append(" * @param {Object} [inputs]\n");
        for (String input : inputs) {
            sb.append(" * @param {").append(jsDocType(request, input)).append("} [inputs.").append(input)
                    .append('=').append(literals.format(defaultOf(request, input))).append("]\n");
        }
        String fields = Stream.concat(inputs.stream(), declarations.stream().map(Declaration::name))
                .map(name -> name + ": " + jsDocType(request, name))
                .collect(Collectors.joining(", "));
        sb.append(" * @returns {{").append(fields).append("}}\n");
        sb.append(" */\n");
    }

    private void renderFunction(StringBuilder sb, SynthesisRequest request, List<String> inputs,
                                List<Declaration> declarations) {
        String parameters = inputs.stream()
                .map(name -> name + " = " + literals.format(defaultOf(request, name)))
                .collect(Collectors.joining(", "));
        String pattern = parameters.isEmpty() ? "{}" : "{ " + parameters + " }";
        sb.append("function calculate(").append(pattern);
        if (typescript) {
            sb.append(": CalculationInputs = {}): CalculationResult {\n");
        } else {
            sb.append(" = {}) {\n");
        }

        for (Declaration declaration : declarations) {
            sb.append("  // ").append(declaration.name()).append('\n');
            String annotation = typescript ? ": " + tsType(request, declaration.name()) : "";
            sb.append("  const ").append(declaration.name()).append(annotation).append(" = ");
            if (declaration.statements().isEmpty()) {
                sb.append(declaration.expression()).append(";\n");
                continue;
            }
            sb.append("(() => {\n");
            Set<String> declared = new HashSet<>();
            for (String statement : declaration.statements()) {
                String target = assignedName(statement);
                boolean first = target != null && declared.add(target);
                sb.append("    ").append(first ? "let " : "").append(statement).append(";\n");
            }
            sb.append("    return ").append(declaration.expression()).append(";\n");
            sb.append("  })();\n");
        }

        sb.append("  return {\n");
        for (String input : inputs) {
            sb.append("    ").append(input).append(",\n");
        }
        for (Declaration declaration : declarations) {
            sb.append("    ").append(declaration.name()).append(",\n");
        }
        sb.append("  };\n");
        sb.append("}\n");
    }

    private static Object defaultOf(SynthesisRequest request, String name) {
        VariableInfo info = request.graph().getVariable(name);
        return info != null ? info.defaultValue() : 0;
    }

    private static String tsType(SynthesisRequest request, String name) {
        VariableInfo info = request.graph().getVariable(name);
        return switch (info != null ? info.valueType() : "float") {
            case "float", "int", "number" -> "number";
            case "bool", "boolean" -> "boolean";
            case "str", "string" -> "string";
            default -> "any";
        };
    }

    private static String jsDocType(SynthesisRequest request, String name) {
        String type = tsType(request, name);
        return type.equals("any") ? "*" : type;
    }
}
