package ai.masked.translator.cli;

import ai.masked.translator.config.Config;
import ai.masked.translator.config.ConfigLoader;
import ai.masked.translator.config.EnvironmentReader;
import ai.masked.translator.http.HttpTransport;
import ai.masked.translator.http.JdkHttpTransport;
import ai.masked.translator.logging.LoggingConfigurator;
import ai.masked.translator.model.ModelRegistry;
import ai.masked.translator.model.driver.DriverFactory;
import ai.masked.translator.prompt.PromptCatalog;
import ai.masked.translator.translate.AuthException;
import ai.masked.translator.translate.TranslationException;
import ai.masked.translator.translate.TranslationPipeline;
import ai.masked.translator.translate.TranslationReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and translation pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final HttpTransport transport;
    private final InputStream stdin;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new JdkHttpTransport(), System.in,
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, HttpTransport transport, InputStream stdin, PrintWriter out, PrintWriter err) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.stdin = Objects.requireNonNull(stdin, "stdin");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        ObjectMapper objectMapper = new ObjectMapper();
        PromptCatalog prompts;
        ModelRegistry registry;
        try {
            prompts = cliArguments.promptsFile() != null
                    ? PromptCatalog.load(cliArguments.promptsFile())
                    : PromptCatalog.loadDefault();
            DriverFactory driverFactory = DriverFactory.standard(prompts, objectMapper);
            registry = cliArguments.modelsFile() != null
                    ? ModelRegistry.load(cliArguments.modelsFile(), driverFactory)
                    : ModelRegistry.loadDefault(driverFactory);
        } catch (TranslationException ex) {
            err.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        }

        if (cliArguments.listModels()) {
            ReportPrinter.printModels(registry, out);
            return EXIT_OK;
        }
        if (cliArguments.listPrompts()) {
            ReportPrinter.printPrompts(prompts, out);
            return EXIT_OK;
        }

        Config config;
        try {
            config = configLoader.load(cliArguments, registry);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        } catch (TranslationException ex) {
            err.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.debug("Loaded configuration for {} ({})", config.modelKey(), config.secrets());

        String text;
        try {
            text = readSource(config);
        } catch (IOException ex) {
            err.println("Error: cannot read input: " + ex.getMessage());
            return EXIT_FAILURE;
        }
        if (text.isBlank()) {
            err.println("Error: Nothing to translate");
            return EXIT_FAILURE;
        }

        TranslationPipeline pipeline = new TranslationPipeline(registry, transport);
        TranslationReport report;
        try {
            report = pipeline.translate(config.toRequest(text));
        } catch (TranslationException ex) {
            printFailure(ex, registry, config);
            return EXIT_FAILURE;
        }

        if (config.verbose() || config.dryRun()) {
            printDebug(report.debugRequest(), report.debugResponse());
        }
        try {
            writeResult(config, report.result());
        } catch (IOException ex) {
            err.println("Error: cannot write output: " + ex.getMessage());
            return EXIT_FAILURE;
        }
        ReportPrinter.printSummary(report, err);
        return EXIT_OK;
    }

    private String readSource(Config config) throws IOException {
        if (config.source().isPresent()) {
            return Files.readString(config.source().get(), StandardCharsets.UTF_8);
        }
        return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
    }

    private void writeResult(Config config, String result) throws IOException {
        if (config.output().isPresent()) {
            Path output = config.output().get();
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, result, StandardCharsets.UTF_8);
            err.println("Translation written to " + output);
        } else {
            out.println(result);
            out.flush();
        }
    }

    private void printFailure(TranslationException ex, ModelRegistry registry, Config config) {
        err.println("Error: " + ex.getMessage());
        if (ex instanceof AuthException) {
            registry.getHelpUrl(config.modelKey()).ifPresent(url -> err.println("Get an API key at " + url));
        }
        ex.diagnostics().ifPresent(diagnostics -> err.println(diagnostics.describe()));
        err.flush();
    }

    private void printDebug(String debugRequest, String debugResponse) {
        if (!debugRequest.isBlank()) {
            err.println(debugRequest);
        }
        if (!debugResponse.isBlank()) {
            err.println(debugResponse);
        }
        err.flush();
    }
}
