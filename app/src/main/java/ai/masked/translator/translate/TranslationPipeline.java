package ai.masked.translator.translate;

import ai.masked.translator.filter.FilterPipeline;
import ai.masked.translator.filter.PlaceholderCounter;
import ai.masked.translator.http.HttpCall;
import ai.masked.translator.http.HttpExchange;
import ai.masked.translator.http.HttpTransport;
import ai.masked.translator.http.SecretMasker;
import ai.masked.translator.model.AuthRequirement;
import ai.masked.translator.model.BodyType;
import ai.masked.translator.model.DriverRequest;
import ai.masked.translator.model.DriverResponse;
import ai.masked.translator.model.ModelConfig;
import ai.masked.translator.model.ModelDriver;
import ai.masked.translator.model.ModelRegistry;
import ai.masked.translator.model.UsageNormalizer;
import ai.masked.translator.model.UsageReport;
import ai.masked.translator.validation.HtmlValidator;
import ai.masked.translator.validation.JsonValidator;
import ai.masked.translator.validation.Schema;
import ai.masked.translator.validation.SchemaNode;
import ai.masked.translator.validation.TextLengthValidator;
import ai.masked.translator.validation.ValidationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs one document through pre-validation, masking, the vendor call, unmasking and
 * post-validation. Every run gets fresh filters and state; the registry and transport
 * are only read, so one instance can serve concurrent callers.
 */
public class TranslationPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationPipeline.class);

    static final String MDC_MODEL = "model";
    static final String MDC_STAGE = "stage";
    static final String SCHEMA_CAPTURED = "[JSON schema captured]";
    static final String SCHEMA_VALIDATED = "[JSON schema validated]";

    private final ModelRegistry registry;
    private final HttpTransport transport;
    private final UsageNormalizer usageNormalizer;
    private final ObjectMapper objectMapper;
    private final JsonValidator jsonValidator;
    private final HtmlValidator htmlValidator;

    public TranslationPipeline(ModelRegistry registry, HttpTransport transport) {
        this(registry, transport, new UsageNormalizer(), new ObjectMapper());
    }

    public TranslationPipeline(ModelRegistry registry, HttpTransport transport, UsageNormalizer usageNormalizer,
                               ObjectMapper objectMapper) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.usageNormalizer = Objects.requireNonNull(usageNormalizer, "usageNormalizer");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.jsonValidator = new JsonValidator(objectMapper);
        this.htmlValidator = new HtmlValidator();
    }

    public TranslationReport translate(TranslationRequest request) {
        Objects.requireNonNull(request, "request");
        Run run = new Run(request);
        String previousModel = MDC.get(MDC_MODEL);
        String previousStage = MDC.get(MDC_STAGE);
        MDC.put(MDC_MODEL, request.modelKey());
        try {
            return execute(run);
        } catch (TranslationException ex) {
            PipelineStage failedAt = run.stage;
            run.enter(PipelineStage.ERRORED);
            ex.redact(run.masker);
            LOGGER.warn("Translation failed during {}: {}", failedAt, ex.getMessage());
            throw ex.withDiagnostics(run.diagnostics(failedAt));
        } finally {
            restoreMdc(MDC_STAGE, previousStage);
            restoreMdc(MDC_MODEL, previousModel);
        }
    }

    private TranslationReport execute(Run run) {
        TranslationRequest request = run.request;
        run.enter(PipelineStage.START);
        ModelConfig config = registry.require(request.modelKey());
        ModelDriver driver = registry.getDriver(request.modelKey());
        FilterPipeline filters = FilterPipeline.fromIds(request.filters());
        LOGGER.info("Translating {} chars of {} with {} (dryRun={}, filters={})",
                run.originalLength, request.format().id(), config.key(), request.dryRun(), request.filters());

        run.enter(PipelineStage.PRE_VALIDATE);
        if (!filters.isEmpty()) {
            rejectExistingPlaceholders(request.text());
        }
        JsonNode sourceTree = null;
        SchemaNode sourceSchema = null;
        if (request.validate()) {
            validateSyntax(request.format(), request.text(), "Input");
            if (request.format() == TranslationFormat.JSON) {
                sourceTree = jsonValidator.parse(request.text());
                sourceSchema = Schema.capture(sourceTree);
            }
        }

        run.enter(PipelineStage.MASK);
        run.prepared = filters.apply(request.text());
        LOGGER.debug("Filter stats {} ({} placeholder(s) issued)", filters.stats(), filters.issuedTokens());
        if (request.validate()) {
            ValidationResult length = TextLengthValidator.fromModelLimits(config.limits()).validate(run.prepared);
            if (!length.valid()) {
                throw new ValidationException("Prepared text is too long for " + config.key(), length.errors());
            }
        }

        run.enter(PipelineStage.BUILD_REQUEST);
        DriverRequest driverRequest = driver.buildRequest(config, run.prepared, request.driverOptions());

        run.enter(PipelineStage.AUTHENTICATE);
        driverRequest = authenticate(config, request, driverRequest, run);

        run.enter(PipelineStage.TRANSMIT);
        HttpExchange exchange = transport.request(new HttpCall("POST", driverRequest.url(), driverRequest.body(),
                driverRequest.headers(), request.proxy(), request.dryRun(), request.verbose(), run.masker.secrets()));
        run.httpStatus = exchange.status();
        run.rawBody = exchange.body();
        run.debugRequest = exchange.debugRequest();
        run.debugResponse = exchange.debugResponse();
        if (request.verbose() && sourceSchema != null) {
            run.debugRequest = appendLine(run.debugRequest, SCHEMA_CAPTURED);
        }

        String translated;
        Optional<JsonNode> rawUsage = Optional.empty();
        if (request.dryRun()) {
            translated = run.prepared;
        } else {
            if (exchange.status() >= 400 && !config.httpErrorHandling()) {
                throw httpFailure(exchange, driverRequest, run);
            }
            run.enter(PipelineStage.PARSE_RESPONSE);
            DriverResponse response = driver.parseResponse(config, exchange.body());
            if (exchange.status() >= 400) {
                throw httpFailure(exchange, driverRequest, run);
            }
            translated = response.text();
            rawUsage = response.usage();
        }

        run.enter(PipelineStage.UNMASK);
        String result = filters.restore(translated);

        run.enter(PipelineStage.POST_VALIDATE);
        if (request.validate()) {
            validateSyntax(request.format(), result, "Translated output");
            if (sourceSchema != null) {
                result = compareSchema(sourceTree, sourceSchema, result, run);
            }
        }

        run.enter(PipelineStage.NORMALIZE_USAGE);
        UsageReport usage = usageNormalizer.normalize(config, rawUsage);

        run.enter(PipelineStage.DONE);
        TextLengths lengths = new TextLengths(run.originalLength, TextLengths.of(run.prepared), TextLengths.of(result));
        LOGGER.info("Translated {} -> {} chars with {} (status={})", lengths.original(), lengths.translated(),
                config.key(), run.httpStatus);
        return new TranslationReport(request.text(), run.prepared, result, run.httpStatus, run.debugRequest,
                run.debugResponse, run.masker.mask(run.rawBody), usage, lengths, filters.stats());
    }

    private void rejectExistingPlaceholders(String text) {
        Matcher matcher = PlaceholderCounter.TOKEN_PATTERN.matcher(text);
        if (matcher.find()) {
            throw new ValidationException("Input already contains placeholder syntax",
                    List.of("found '" + matcher.group() + "' at offset " + matcher.start()
                            + "; remove it or translate without filters"));
        }
    }

    private void validateSyntax(TranslationFormat format, String content, String label) {
        ValidationResult result = switch (format) {
            case JSON -> jsonValidator.validate(content);
            case HTML -> htmlValidator.validate(content);
            case TEXT -> ValidationResult.success();
        };
        if (!result.valid()) {
            throw new ValidationException(label + " is not valid " + format.id(), result.errors());
        }
    }

    private String compareSchema(JsonNode sourceTree, SchemaNode sourceSchema, String result, Run run) {
        TranslationRequest request = run.request;
        JsonNode translatedTree = jsonValidator.parse(result);
        ValidationResult comparison = Schema.validate(sourceSchema, Schema.capture(translatedTree));
        String output = result;
        if (!comparison.valid() && !request.repairs().isEmpty()) {
            JsonNode repaired = Schema.applyRepairs(sourceTree, translatedTree, request.repairs());
            ValidationResult repairedComparison = Schema.validate(sourceSchema, Schema.capture(repaired));
            if (repairedComparison.valid()) {
                LOGGER.info("Applied JSON repairs {} to translated output", request.repairs());
                comparison = repairedComparison;
                output = writeJson(repaired);
            }
        }
        if (!comparison.valid()) {
            throw new ValidationException("Translated JSON does not match the source structure", comparison.errors());
        }
        if (request.verbose()) {
            run.debugResponse = appendLine(run.debugResponse, SCHEMA_VALIDATED);
        }
        return output;
    }

    private DriverRequest authenticate(ModelConfig config, TranslationRequest request, DriverRequest driverRequest, Run run) {
        Optional<AuthRequirement> requirement = config.auth();
        if (requirement.isEmpty()) {
            return driverRequest;
        }
        AuthRequirement auth = requirement.get();
        Optional<String> apiKey = request.apiKey();
        if (apiKey.isEmpty()) {
            if (request.dryRun()) {
                LOGGER.debug("No credential for {}; dry run continues without one", config.key());
                return driverRequest;
            }
            StringBuilder message = new StringBuilder("Missing API key for model ").append(config.key());
            auth.env().ifPresent(env -> message.append(" (set ").append(env).append(")"));
            auth.helpUrl().ifPresent(url -> message.append("; get one at ").append(url));
            throw new AuthException(message.toString());
        }
        String secret = apiKey.get();
        String value = auth.credentialValue(secret);
        run.addSecret(secret);
        run.addSecret(URLEncoder.encode(secret, StandardCharsets.UTF_8));
        String encoded = URLEncoder.encode(auth.keyName(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(value, StandardCharsets.UTF_8);
        return switch (auth.type()) {
            case HEADER -> driverRequest.withHeader(auth.keyName(), value);
            case QUERY -> driverRequest.withUrl(driverRequest.url() + (driverRequest.url().contains("?") ? "&" : "?") + encoded);
            case FORM -> {
                if (driverRequest.bodyType() != BodyType.FORM) {
                    throw new ConfigurationException("Model " + config.key() + " declares form authentication but sends a "
                            + driverRequest.bodyType().name().toLowerCase(Locale.ROOT) + " body");
                }
                String body = driverRequest.body();
                yield driverRequest.withBody(body.isEmpty() ? encoded : body + "&" + encoded);
            }
        };
    }

    private TransportException httpFailure(HttpExchange exchange, DriverRequest driverRequest, Run run) {
        return new TransportException("HTTP " + exchange.status() + " from " + run.masker.mask(driverRequest.url()),
                exchange.status(), run.masker.mask(exchange.body()));
    }

    private String writeJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new ValidationException("Failed to serialize repaired JSON", List.of(ex.getOriginalMessage()));
        }
    }

    private static void restoreMdc(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }

    private static String appendLine(String text, String line) {
        return text == null || text.isEmpty() ? line : text + System.lineSeparator() + line;
    }

    /**
     * Mutable state of a single run, kept for diagnostics.
     */
    private static final class Run {
        private final TranslationRequest request;
        private final int originalLength;
        private final List<String> secrets = new ArrayList<>();
        private SecretMasker masker = SecretMasker.none();
        private PipelineStage stage = PipelineStage.START;
        private String prepared = "";
        private String debugRequest = "";
        private String debugResponse = "";
        private String rawBody = "";
        private int httpStatus;

        Run(TranslationRequest request) {
            this.request = request;
            this.originalLength = TextLengths.of(request.text());
        }

        void enter(PipelineStage next) {
            stage = next;
            MDC.put(MDC_STAGE, next.name());
            LOGGER.debug("Entering {}", next);
        }

        void addSecret(String secret) {
            secrets.add(secret);
            masker = new SecretMasker(secrets);
        }

        PipelineDiagnostics diagnostics(PipelineStage failedAt) {
            return new PipelineDiagnostics(failedAt, originalLength, TextLengths.of(prepared),
                    masker.mask(debugRequest), masker.mask(debugResponse), masker.mask(rawBody), httpStatus);
        }
    }
}
