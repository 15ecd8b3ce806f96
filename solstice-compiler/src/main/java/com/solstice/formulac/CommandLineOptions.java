package com.solstice.formulac;

import com.solstice.formulac.api.model.ModuleFormat;
import com.solstice.formulac.api.model.TargetLanguage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parsed command-line arguments of {@link FormulaCompilerApplication}.
 * Both {@code --name value} and {@code --name=value} are accepted.
 */
public final class CommandLineOptions {

    static final String USAGE = String.join("\n",
            "Usage: solstice-compiler --rules <file> --variables <a,b,...> [options]",
            "",
            "  --rules <file>        rule-set JSON document",
            "  --variables <list>    comma-separated target variables",
            "  --output <file>       write the module here (default: standard output)",
            "  --date <YYYY-MM-DD>   parameter resolution date (default: today)",
            "  --year <N>            shorthand for --date N-01-01",
            "  --reform <file>       reform JSON document",
            "  --target <lang>       python | javascript | typescript (default: python)",
            "  --module <format>     esm | commonjs | iife | none (JavaScript targets)",
            "  --html <file>         also write a standalone HTML calculator page",
            "  --title <text>        title of the HTML page",
            "  --dry-run             print the evaluation plan instead of generating code",
            "  --strict              fail on circular variable definitions",
            "  --help                show this message");

    private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private Path rules;
    private final List<String> variables = new ArrayList<>();
    private Path output;
    private String instant;
    private Path reform;
    private TargetLanguage language = TargetLanguage.PYTHON;
    private ModuleFormat moduleFormat;
    private Path html;
    private String title = "Policy Calculator";
    private boolean dryRun;
    private Boolean strict;
    private boolean help;

    private CommandLineOptions() {
    }

    /**
     * @throws IllegalArgumentException on unknown flags, missing values or
     *         missing required options
     */
    public static CommandLineOptions parse(String[] args) {
        CommandLineOptions options = new CommandLineOptions();
        boolean dateSeen = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String inline = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                inline = arg.substring(eq + 1);
                arg = arg.substring(0, eq);
            }
            switch (arg) {
                case "--help", "-h" -> options.help = true;
                case "--dry-run" -> options.dryRun = true;
                case "--strict" -> options.strict = true;
                case "--rules" -> options.rules = Path.of(value(args, i++, arg, inline));
                case "--output", "-o" -> options.output = Path.of(value(args, i++, arg, inline));
                case "--reform" -> options.reform = Path.of(value(args, i++, arg, inline));
                case "--html" -> options.html = Path.of(value(args, i++, arg, inline));
                case "--title" -> options.title = value(args, i++, arg, inline);
                case "--variables" -> Arrays.stream(value(args, i++, arg, inline).split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .forEach(options.variables::add);
                case "--date" -> {
                    if (dateSeen) throw new IllegalArgumentException("Use either --date or --year, not both");
                    dateSeen = true;
                    String date = value(args, i++, arg, inline);
                    if (!DATE.matcher(date).matches()) {
                        throw new IllegalArgumentException("--date must be formatted YYYY-MM-DD, got: " + date);
                    }
                    options.instant = date;
                }
                case "--year" -> {
                    if (dateSeen) throw new IllegalArgumentException("Use either --date or --year, not both");
                    dateSeen = true;
                    String year = value(args, i++, arg, inline);
                    try {
                        options.instant = String.format("%04d-01-01", Integer.parseInt(year));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--year must be a number, got: " + year, e);
                    }
                }
                case "--target" -> {
                    String target = value(args, i++, arg, inline);
                    options.language = TargetLanguage.fromString(target);
                    if (options.language == null) {
                        throw new IllegalArgumentException("Unknown target: " + target
                                + " (expected python, javascript or typescript)");
                    }
                }
                case "--module" -> {
                    String format = value(args, i++, arg, inline);
                    options.moduleFormat = ModuleFormat.fromString(format);
                    if (options.moduleFormat == null) {
                        throw new IllegalArgumentException("Unknown module format: " + format
                                + " (expected esm, commonjs, iife or none)");
                    }
                }
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
            if (inline != null && !takesValue(arg)) {
                throw new IllegalArgumentException("Option " + arg + " takes no value");
            }
            if (inline != null) {
                i--; // value came from the same argument
            }
        }
        if (!options.help) {
            if (options.rules == null) {
                throw new IllegalArgumentException("Missing required option --rules");
            }
            if (options.variables.isEmpty()) {
                throw new IllegalArgumentException("Missing required option --variables");
            }
        }
        return options;
    }

    private static String value(String[] args, int i, String flag, String inline) {
        if (inline != null) {
            return inline;
        }
        if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
            throw new IllegalArgumentException("Option " + flag + " requires a value");
        }
        return args[i + 1];
    }

    private static boolean takesValue(String flag) {
        return !(flag.equals("--help") || flag.equals("-h") || flag.equals("--dry-run") || flag.equals("--strict"));
    }

    public Path rules() {
        return rules;
    }

    public List<String> variables() {
        return List.copyOf(variables);
    }

    public Path output() {
        return output;
    }

    /**
     * Resolution date, or null for today.
     */
    public String instant() {
        return instant;
    }

    public Path reform() {
        return reform;
    }

    public TargetLanguage language() {
        return language;
    }

    public ModuleFormat moduleFormat() {
        return moduleFormat;
    }

    public Path html() {
        return html;
    }

    public String title() {
        return title;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public Boolean strict() {
        return strict;
    }

    public boolean help() {
        return help;
    }
}
