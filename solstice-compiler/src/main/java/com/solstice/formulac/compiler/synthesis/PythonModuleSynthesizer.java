package com.solstice.formulac.compiler.synthesis;

import com.solstice.formulac.api.model.GeneratedModule.Declaration;
import com.solstice.formulac.api.model.TargetLanguage;
import com.solstice.formulac.api.model.VariableInfo;
import com.solstice.formulac.compiler.config.CompilerConfig;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Emits a Python module. The formula dialect is already Python, so the
 * shared rewrites are all it needs; values are read back through the
 * {@code results} dictionary.
 *
 * <pre>
 * def calculate(income=0):
 *     results = {}
 *     results['income'] = income
 *
 *     # Calculate income_tax
 *     income_tax = results['income'] * 0.2
 *     results['income_tax'] = income_tax
 *
 *     return results
 * </pre>
 */
public class PythonModuleSynthesizer extends AbstractModuleSynthesizer {

    private static final String INDENT = "    ";

    public PythonModuleSynthesizer(CompilerConfig config) {
        super(config, LiteralFormatter.PYTHON, EntityCallRewriter.python(config), AggregationRewriter.python());
    }

    @Override
    public TargetLanguage language() {
        return TargetLanguage.PYTHON;
    }

    @Override
    protected String render(SynthesisRequest request, List<String> inputs, List<Declaration> declarations) {
        StringBuilder sb = new StringBuilder();
        sb.append("\"\"\"\n");
        sb.append("Calculation module generated by solstice-formula-compiler.\n\n");
        sb.append("Targets: ").append(String.join(", ", request.targets())).append('\n');
        sb.append("Parameters resolved at: ").append(request.instant()).append('\n');
        sb.append("\"\"\"\n\n");
        sb.append("import numpy as np\n");
        sb.append("from numpy import where, maximum, minimum, zeros, ones\n");
        sb.append("from numpy import maximum as max_, minimum as min_\n\n\n");

        String signature = inputs.stream()
                .map(name -> name + "=" + literals.format(defaultOf(request, name)))
                .collect(Collectors.joining(", "));
        sb.append("def calculate(").append(signature).append("):\n");
        sb.append(INDENT).append("results = {}\n");
        for (String input : inputs) {
            sb.append(INDENT).append("results['").append(input).append("'] = ").append(input).append('\n');
        }

        for (Declaration declaration : declarations) {
            sb.append('\n');
            sb.append(INDENT).append("# Calculate ").append(declaration.name()).append('\n');
            for (String statement : declaration.statements()) {
                sb.append(INDENT).append(statement).append('\n');
            }
            sb.append(INDENT).append(declaration.name()).append(" = ").append(declaration.expression()).append('\n');
            sb.append(INDENT).append("results['").append(declaration.name()).append("'] = ")
                    .append(declaration.name()).append('\n');
        }

        sb.append('\n').append(INDENT).append("return results\n");
        return sb.toString();
    }

    private static Object defaultOf(SynthesisRequest request, String name) {
        VariableInfo info = request.graph().getVariable(name);
        return info != null ? info.defaultValue() : 0;
    }
}
