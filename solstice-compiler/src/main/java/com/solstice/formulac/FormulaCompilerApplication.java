package com.solstice.formulac;

import com.solstice.formulac.api.CompilationListener;
import com.solstice.formulac.api.exceptions.CompilationException;
import com.solstice.formulac.api.model.CompilationRequest;
import com.solstice.formulac.api.model.CompilationResult;
import com.solstice.formulac.api.model.Diagnostic;
import com.solstice.formulac.api.model.ModuleFormat;
import com.solstice.formulac.api.model.TargetLanguage;
import com.solstice.formulac.api.model.VariableInfo;
import com.solstice.formulac.compiler.FormulaCompiler;
import com.solstice.formulac.compiler.config.CompilerConfig;
import com.solstice.formulac.compiler.synthesis.HtmlDemoRenderer;
import com.solstice.formulac.infrastructure.telemetry.TracingService;
import com.solstice.formulac.registry.JsonHostRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line front end: loads a rule set, compiles the requested variables
 * and writes the generated module (or prints the evaluation plan).
 *
 * <p>Exit status is 0 on success, 1 on compilation or I/O failure and 2 on
 * invalid arguments.
 */
public class FormulaCompilerApplication {

    private static final Logger logger = Logger.getLogger(FormulaCompilerApplication.class.getName());

    private final PrintStream out;
    private final PrintStream err;

    FormulaCompilerApplication(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(new FormulaCompilerApplication(System.out, System.err).run(args));
    }

    int run(String[] args) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(CommandLineOptions.USAGE);
            return 2;
        }
        if (options.help()) {
            out.println(CommandLineOptions.USAGE);
            return 0;
        }

        try {
            execute(options);
            return 0;
        } catch (CompilationException e) {
            logger.log(Level.FINE, "Compilation failed", e);
            err.println("Compilation failed: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.log(Level.FINE, "I/O failure", e);
            err.println("I/O error: " + e.getMessage());
            return 1;
        }
    }

    private void execute(CommandLineOptions options) throws IOException {
        JsonHostRegistry registry = JsonHostRegistry.load(options.rules());
        CompilerConfig config = CompilerConfig.loadDefault();
        FormulaCompiler compiler = new FormulaCompiler(registry, config, TracingService.getInstance().getTracer());
        compiler.setCompilationListener(new LoggingListener());

        String reform = options.reform() != null
                ? Files.readString(options.reform(), StandardCharsets.UTF_8)
                : null;
        CompilationRequest request = new CompilationRequest(options.variables(), options.instant(), reform,
                options.language(), options.moduleFormat(), options.strict());

        if (options.dryRun()) {
            printPlan(compiler.plan(request));
            return;
        }

        CompilationResult result = compiler.compile(request);
        printDiagnostics(result);
        String source = result.module().source();
        if (options.output() != null) {
            Files.writeString(options.output(), source, StandardCharsets.UTF_8);
            err.println("Wrote " + result.module().language().name().toLowerCase() + " module to " + options.output());
        } else {
            out.print(source);
        }

        if (options.html() != null) {
            CompilationRequest demoRequest = new CompilationRequest(request.targets(), request.instant(),
                    request.reform(), TargetLanguage.JAVASCRIPT, ModuleFormat.NONE, request.strict());
            CompilationResult demo = compiler.compile(demoRequest);
            String page = new HtmlDemoRenderer().render(options.title(), demo.module(), demo.variables());
            Files.writeString(options.html(), page, StandardCharsets.UTF_8);
            err.println("Wrote HTML calculator to " + options.html());
        }
    }

    private void printPlan(CompilationResult result) {
        out.println("Evaluation order (" + result.order().size() + " variables):");
        int position = 1;
        for (String name : result.order()) {
            VariableInfo info = result.variables().get(name);
            String kind = info.isInput() ? "input, default " + info.defaultValue() : "computed";
            out.printf("  %3d. %s (%s)%n", position++, name, kind);
            if (!info.dependencies().isEmpty()) {
                out.println("       depends on: " + String.join(", ", info.dependencies()));
            }
        }
        if (!result.parameters().isEmpty()) {
            out.println("Parameters:");
            for (Map.Entry<String, Object> parameter : result.parameters().entrySet()) {
                out.println("  " + parameter.getKey() + " = " + parameter.getValue());
            }
        }
        printDiagnostics(result);
    }

    private void printDiagnostics(CompilationResult result) {
        for (Diagnostic diagnostic : result.diagnostics()) {
            err.println("Warning: " + diagnostic.message());
        }
    }

    private static void configureLogging() {
        try (InputStream config = FormulaCompilerApplication.class.getClassLoader()
                .getResourceAsStream("logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read logging.properties, using JVM defaults", e);
        }
    }

    /**
     * Reports stage progress through java.util.logging.
     */
    private static final class LoggingListener implements CompilationListener {
        @Override
        public void onStageStart(String stageName, int stageNumber, int totalStages) {
            logger.fine(String.format("Starting %s (%d/%d)", stageName, stageNumber, totalStages));
        }

        @Override
        public void onStageComplete(String stageName, StageResult result) {
            logger.fine(String.format("Completed %s in %d ms %s", stageName, result.durationMillis(), result.metrics()));
        }

        @Override
        public void onError(String stageName, Exception error) {
            logger.warning("Stage " + stageName + " failed: " + error.getMessage());
        }
    }
}
