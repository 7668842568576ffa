package ai.masked.translator.cli;

import ai.masked.translator.config.LogFormat;
import ai.masked.translator.translate.TranslationFormat;
import ai.masked.translator.validation.RepairFeature;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import picocli.CommandLine;

@CommandLine.Command(name = "masked-translator", mixinStandardHelpOptions = true, version = "masked-translator 0.1.0",
        sortOptions = false,
        description = "Translates text, HTML or JSON through an LLM or MT vendor while keeping URLs and chosen markup untouched.")
public class CliArguments {

    @CommandLine.Option(names = "--model", description = "Model key from the registry, e.g. openai:gpt-4o", paramLabel = "KEY")
    private String model;

    @CommandLine.Option(names = "--format", description = "Document format: text, html or json (default: text)",
            converter = CliConverters.FormatConverter.class, paramLabel = "FORMAT")
    private TranslationFormat format;

    @CommandLine.Option(names = "--source", description = "Input file (default: stdin)", paramLabel = "FILE")
    private Path source;

    @CommandLine.Option(names = "--translated", description = "Output file (default: stdout)", paramLabel = "FILE")
    private Path translated;

    @CommandLine.Option(names = "--filters", split = ",", description = "Placeholder filters, e.g. url,html_code,html_pre", paramLabel = "ID")
    private List<String> filters;

    @CommandLine.Option(names = "--context", description = "Extra context passed to the model", paramLabel = "TEXT")
    private String context;

    @CommandLine.Option(names = "--prompt-key", description = "Prompt template kind (default: translator)", paramLabel = "KEY")
    private String promptKey;

    @CommandLine.Option(names = "--source-lang", description = "Source language (default: auto)", paramLabel = "LANG")
    private String sourceLang;

    @CommandLine.Option(names = "--target-lang", description = "Target language (default: EN)", paramLabel = "LANG")
    private String targetLang;

    @CommandLine.Option(names = "--variables", split = ",", description = "Per-call model variables, e.g. folder_id=abc", paramLabel = "NAME=VALUE")
    private Map<String, String> variables;

    @CommandLine.Option(names = "--repair", split = ",", converter = CliConverters.RepairFeatureConverter.class,
            description = "JSON repairs to apply before the structure check, e.g. missing-nulls", paramLabel = "FEATURE")
    private List<RepairFeature> repairs;

    @CommandLine.Option(names = "--no-validate", description = "Skip container syntax, structure and length checks")
    private boolean noValidate;

    @CommandLine.Option(names = "--dry-run", description = "Mask and build the request without sending it")
    private boolean dryRun;

    @CommandLine.Option(names = "--verbose", description = "Print the masked request and response")
    private boolean verbose;

    @CommandLine.Option(names = "--proxy", description = "HTTP proxy, e.g. http://127.0.0.1:8080", converter = CliConverters.ProxyConverter.class, paramLabel = "URI")
    private URI proxy;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = CliConverters.LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--models-file", description = "Model registry YAML (default: bundled)", paramLabel = "FILE")
    private Path modelsFile;

    @CommandLine.Option(names = "--prompts-file", description = "Prompt catalog YAML (default: bundled)", paramLabel = "FILE")
    private Path promptsFile;

    @CommandLine.Option(names = "--list-models", description = "List available models and exit")
    private boolean listModels;

    @CommandLine.Option(names = "--list-prompts", description = "List available prompt templates and exit")
    private boolean listPrompts;

    public String model() {
        return model;
    }

    public TranslationFormat format() {
        return format;
    }

    public Path source() {
        return source;
    }

    public Path translated() {
        return translated;
    }

    public List<String> filters() {
        return filters;
    }

    public String context() {
        return context;
    }

    public String promptKey() {
        return promptKey;
    }

    public String sourceLang() {
        return sourceLang;
    }

    public String targetLang() {
        return targetLang;
    }

    public Map<String, String> variables() {
        return variables;
    }

    public List<RepairFeature> repairs() {
        return repairs;
    }

    public boolean noValidate() {
        return noValidate;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public boolean verbose() {
        return verbose;
    }

    public URI proxy() {
        return proxy;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public Path modelsFile() {
        return modelsFile;
    }

    public Path promptsFile() {
        return promptsFile;
    }

    public boolean listModels() {
        return listModels;
    }

    public boolean listPrompts() {
        return listPrompts;
    }
}
