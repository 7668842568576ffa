package ai.masked.translator.config;

import ai.masked.translator.cli.CliArguments;
import ai.masked.translator.model.DriverOptions;
import ai.masked.translator.model.ModelConfig;
import ai.masked.translator.model.ModelRegistry;
import ai.masked.translator.translate.TranslationFormat;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Config} by combining CLI arguments with environment variables, the
 * selected model's registry entry and defaults.
 */
public class ConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);

    static final String ENV_MODEL = "TRANSLATOR_MODEL";
    static final String ENV_FORMAT = "TRANSLATOR_FORMAT";
    static final String ENV_FILTERS = "TRANSLATOR_FILTERS";
    static final String ENV_DRY_RUN = "DRY_RUN";
    static final String ENV_PROXY = "MASKED_TRANSLATOR_PROXY";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments, ModelRegistry registry) {
        Objects.requireNonNull(arguments, "arguments");
        Objects.requireNonNull(registry, "registry");

        String modelKey = firstNonBlank(arguments.model(), ENV_MODEL)
                .orElseThrow(() -> new IllegalArgumentException("--model must be provided (see --list-models)"));
        ModelConfig model = registry.require(modelKey);

        TranslationFormat format = Optional.ofNullable(arguments.format())
                .or(() -> environmentReader.nonBlank(ENV_FORMAT).map(TranslationFormat::from))
                .orElse(TranslationFormat.TEXT);

        List<String> filters = arguments.filters() != null && !arguments.filters().isEmpty()
                ? arguments.filters()
                : environmentReader.nonBlank(ENV_FILTERS).map(ConfigLoader::splitList).orElse(List.of());

        boolean dryRun = arguments.dryRun() || environmentReader.nonBlank(ENV_DRY_RUN)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);

        Optional<URI> proxy = Optional.ofNullable(arguments.proxy())
                .or(() -> environmentReader.nonBlank(ENV_PROXY).map(ConfigLoader::parseProxy));

        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .or(() -> environmentReader.nonBlank(ENV_LOG_FORMAT).map(LogFormat::from))
                .orElse(LogFormat.TEXT);

        Map<String, String> variables = resolveVariables(model, arguments.variables());
        Secrets secrets = new Secrets(registry.getAuthEnv(modelKey).flatMap(environmentReader::nonBlank));
        if (secrets.apiKey().isEmpty() && model.auth().isPresent()) {
            LOGGER.debug("No API key found for {} in {}", modelKey, registry.getAuthEnv(modelKey).orElse("(no env declared)"));
        }

        return new Config(
                modelKey,
                format,
                Optional.ofNullable(arguments.source()),
                Optional.ofNullable(arguments.translated()),
                filters,
                dryRun,
                arguments.verbose(),
                Optional.ofNullable(arguments.context()),
                firstNonBlank(arguments.promptKey(), null).orElse(DriverOptions.DEFAULT_PROMPT_KEY),
                Optional.ofNullable(arguments.sourceLang()),
                Optional.ofNullable(arguments.targetLang()),
                !arguments.noValidate(),
                variables,
                proxy,
                arguments.repairs() == null ? null : Set.copyOf(arguments.repairs()),
                logFormat,
                secrets);
    }

    private Map<String, String> resolveVariables(ModelConfig model, Map<String, String> cliVariables) {
        Map<String, String> variables = new LinkedHashMap<>();
        model.variables().forEach((name, envKey) ->
                environmentReader.nonBlank(envKey).ifPresent(value -> variables.put(name, value)));
        if (cliVariables != null) {
            cliVariables.forEach((name, value) -> {
                if (name == null || name.isBlank()) {
                    throw new IllegalArgumentException("--variables entries must look like name=value");
                }
                variables.put(name.trim(), value == null ? "" : value.trim());
            });
        }
        return variables;
    }

    private Optional<String> firstNonBlank(String cliValue, String envKey) {
        if (isNotBlank(cliValue)) {
            return Optional.of(cliValue.trim());
        }
        return envKey == null ? Optional.empty() : environmentReader.nonBlank(envKey);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static List<String> splitList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toList());
    }

    public static URI parseProxy(String raw) {
        try {
            URI uri = new URI(raw.contains("://") ? raw : "http://" + raw);
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("Proxy must include a host: " + raw);
            }
            return uri;
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid proxy: " + raw, ex);
        }
    }
}
