package com.solstice.formulac.compiler.synthesis;

import com.solstice.formulac.api.model.GeneratedModule;
import com.solstice.formulac.api.model.GeneratedModule.Declaration;
import com.solstice.formulac.api.model.TargetLanguage;
import com.solstice.formulac.api.model.VariableInfo;

import java.util.Map;

/**
 * Renders a static HTML page that embeds a JavaScript module and wires one
 * form control per input to a live results table.
 *
 * <p>Boolean inputs become checkboxes, string inputs text fields and every
 * other input a numeric field. The embedded module must not use an export
 * statement, so callers synthesize it with {@code ModuleFormat.NONE}.
 */
public class HtmlDemoRenderer {

    public String render(String title, GeneratedModule module, Map<String, VariableInfo> variables) {
        if (module.language() != TargetLanguage.JAVASCRIPT) {
            throw new IllegalArgumentException("HTML demo requires a JavaScript module, got " + module.language());
        }
        String safeTitle = escapeHtml(title);
        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n");
        sb.append("<html lang=\"en\">\n");
        sb.append("<head>\n");
        sb.append("  <meta charset=\"UTF-8\">\n");
        sb.append("  <meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n");
        sb.append("  <title>").append(safeTitle).append("</title>\n");
        sb.append("  <style>\n");
        sb.append("    body { font-family: sans-serif; max-width: 720px; margin: 2rem auto; padding: 0 1rem; }\n");
        sb.append("    fieldset { margin-bottom: 1.5rem; }\n");
        sb.append("    label { display: block; margin: 0.5rem 0; }\n");
        sb.append("    table { border-collapse: collapse; width: 100%; }\n");
        sb.append("    td { border-bottom: 1px solid #ddd; padding: 0.4rem; }\n");
        sb.append("    td.value { text-align: right; font-family: monospace; }\n");
        sb.append("  </style>\n");
        sb.append("</head>\n");
        sb.append("<body>\n");
        sb.append("  <h1>").append(safeTitle).append("</h1>\n");

        sb.append("  <fieldset>\n");
        sb.append("    <legend>Inputs</legend>\n");
        for (String input : module.inputs()) {
            renderInput(sb, input, variables.get(input));
        }
        sb.append("  </fieldset>\n");

        sb.append("  <table>\n");
        sb.append("    <tbody>\n");
        for (Declaration declaration : module.declarations()) {
            String name = escapeHtml(declaration.name());
            sb.append("      <tr><td>").append(name).append("</td><td class=\"value\" id=\"result-")
                    .append(name).append("\"></td></tr>\n");
        }
        sb.append("    </tbody>\n");
        sb.append("  </table>\n");

        sb.append("  <script>\n");
        sb.append(module.source().replace("</script", "<\\/script"));
        sb.append('\n');
        sb.append("function readInputs() {\n");
        sb.append("  const inputs = {};\n");
        sb.append("  document.querySelectorAll('[data-input]').forEach((el) => {\n");
        sb.append("    if (el.type === 'checkbox') inputs[el.name] = el.checked;\n");
        sb.append("    else if (el.type === 'number') inputs[el.name] = parseFloat(el.value) || 0;\n");
        sb.append("    else inputs[el.name] = el.value;\n");
        sb.append("  });\n");
        sb.append("  return inputs;\n");
        sb.append("}\n\n");
        sb.append("function updateResults() {\n");
        sb.append("  const results = calculate(readInputs());\n");
        sb.append("  for (const [name, value] of Object.entries(results)) {\n");
        sb.append("    const cell = document.getElementById('result-' + name);\n");
        sb.append("    if (!cell) continue;\n");
        sb.append("    cell.textContent = typeof value === 'number' ? value.toFixed(2) : String(value);\n");
        sb.append("  }\n");
        sb.append("}\n\n");
        sb.append("document.querySelectorAll('[data-input]').forEach((el) => {\n");
        sb.append("  el.addEventListener('input', updateResults);\n");
        sb.append("  el.addEventListener('change', updateResults);\n");
        sb.append("});\n");
        sb.append("updateResults();\n");
        sb.append("  </script>\n");
        sb.append("</body>\n");
        sb.append("</html>\n");
        return sb.toString();
    }

    private static void renderInput(StringBuilder sb, String input, VariableInfo info) {
        String name = escapeHtml(input);
        String type = info != null ? info.valueType() : "float";
        Object defaultValue = info != null ? info.defaultValue() : 0;
        switch (type) {
            case "bool", "boolean" -> {
                String checked = Boolean.TRUE.equals(defaultValue) ? " checked" : "";
                sb.append("    <label><input type=\"checkbox\" data-input name=\"").append(name)
                        .append("\"").append(checked).append("> ").append(name).append("</label>\n");
            }
            case "str", "string" -> sb.append("    <label>").append(name)
                    .append(" <input type=\"text\" data-input name=\"").append(name).append("\" value=\"")
                    .append(escapeHtml(String.valueOf(defaultValue))).append("\"></label>\n");
            default -> sb.append("    <label>").append(name)
                    .append(" <input type=\"number\" step=\"any\" data-input name=\"").append(name)
                    .append("\" value=\"").append(escapeHtml(String.valueOf(defaultValue))).append("\"></label>\n");
        }
    }

    static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }
}
