package ai.masked.translator.model;

import ai.masked.translator.model.driver.DriverFactory;
import ai.masked.translator.translate.ConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only catalog of translation models loaded from YAML.
 *
 * <p>A top-level entry carrying a {@code models:} mapping is a vendor group: every sub-entry
 * becomes a model keyed {@code vendor:name}, deep-merged over the vendor settings so the
 * sub-entry wins. Entries without {@code models:} are single models keyed as written.
 */
public final class ModelRegistry {

    public static final String DEFAULT_RESOURCE = "models.yaml";

    private final Map<String, ModelConfig> models;
    private final DriverFactory driverFactory;

    public ModelRegistry(Map<String, ModelConfig> models, DriverFactory driverFactory) {
        this.models = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(models, "models")));
        this.driverFactory = Objects.requireNonNull(driverFactory, "driverFactory");
    }

    public static ModelRegistry loadDefault(DriverFactory driverFactory) {
        InputStream stream = ModelRegistry.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (stream == null) {
            throw new ConfigurationException("Model registry resource not found: " + DEFAULT_RESOURCE);
        }
        try (InputStream in = stream) {
            return load(in, driverFactory);
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read model registry " + DEFAULT_RESOURCE, ex);
        }
    }

    public static ModelRegistry load(Path path, DriverFactory driverFactory) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Model registry not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, driverFactory);
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read model registry " + path, ex);
        }
    }

    public static ModelRegistry load(InputStream in, DriverFactory driverFactory) throws IOException {
        JsonNode root = new ObjectMapper(new YAMLFactory()).readTree(in);
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Model registry must be a mapping of models");
        }
        Map<String, ModelConfig> models = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> entries = root.fields(); entries.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String name = entry.getKey();
            JsonNode node = entry.getValue();
            if (!node.isObject()) {
                throw new ConfigurationException("Model entry '" + name + "' must be a mapping");
            }
            JsonNode subModels = node.get("models");
            if (subModels != null && subModels.isObject()) {
                ObjectNode vendorSettings = ((ObjectNode) node).deepCopy();
                vendorSettings.remove("models");
                if (!vendorSettings.hasNonNull("vendor")) {
                    vendorSettings.put("vendor", name);
                }
                subModels.fields().forEachRemaining(sub -> {
                    ObjectNode merged = deepMerge(vendorSettings.deepCopy(), sub.getValue());
                    String key = name + ":" + sub.getKey();
                    models.put(key, toModelConfig(key, merged));
                });
            } else {
                models.put(name, toModelConfig(name, node));
            }
        }
        return new ModelRegistry(models, driverFactory);
    }

    public boolean has(String key) {
        return models.containsKey(key);
    }

    public Optional<ModelConfig> get(String key) {
        return Optional.ofNullable(models.get(key));
    }

    public ModelConfig require(String key) {
        ModelConfig config = models.get(key);
        if (config == null) {
            throw new ConfigurationException("Unknown model key: " + key);
        }
        return config;
    }

    /**
     * All models, sorted by key.
     */
    public List<ModelConfig> list() {
        return List.copyOf(models.values());
    }

    /**
     * Models grouped by vendor, vendors and keys sorted.
     */
    public Map<String, List<ModelConfig>> listByVendor() {
        Map<String, List<ModelConfig>> grouped = new TreeMap<>();
        for (ModelConfig config : models.values()) {
            grouped.computeIfAbsent(config.vendor(), vendor -> new ArrayList<>()).add(config);
        }
        return grouped;
    }

    public String getEndpoint(String key) {
        return require(key).endpoint();
    }

    public String getFormat(String key) {
        return require(key).format();
    }

    /**
     * Estimated character limit, or 0 when the model does not declare one.
     */
    public int getCharLimit(String key) {
        return require(key).limits().estimatedMaxChars();
    }

    public Optional<String> getAuthEnv(String key) {
        return require(key).auth().flatMap(AuthRequirement::env);
    }

    public Optional<String> getHelpUrl(String key) {
        return require(key).auth().flatMap(AuthRequirement::helpUrl);
    }

    public Optional<String> getNotes(String key) {
        return require(key).notes();
    }

    /**
     * Per-call variables the model needs, mapped to the environment variable that supplies each.
     */
    public Map<String, String> getVariables(String key) {
        return require(key).variables();
    }

    public ModelDriver getDriver(String key) {
        return driverFactory.create(require(key).vendor());
    }

    static ObjectNode deepMerge(ObjectNode base, JsonNode override) {
        override.fields().forEachRemaining(field -> {
            JsonNode existing = base.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                deepMerge((ObjectNode) existing, field.getValue());
            } else {
                base.set(field.getKey(), field.getValue().deepCopy());
            }
        });
        return base;
    }

    private static ModelConfig toModelConfig(String key, JsonNode node) {
        String vendor = text(node.get("vendor"))
                .orElseThrow(() -> new ConfigurationException("Model '" + key + "' has no vendor"));
        String endpoint = text(node.get("endpoint"))
                .orElseThrow(() -> new ConfigurationException("Model '" + key + "' has no endpoint"));
        JsonNode requirements = node.path("requirements");
        JsonNode limits = node.path("limits");
        try {
            return new ModelConfig(
                    key,
                    vendor,
                    endpoint,
                    text(node.get("format")).orElse("text"),
                    node.path("defaults").isObject() ? node.get("defaults").deepCopy() : null,
                    readAuth(requirements.path("auth")),
                    readStringMap(requirements.path("headers")),
                    new ModelLimits(
                            limits.path("estimated_max_chars").asInt(0),
                            limits.path("max_tokens").asInt(0),
                            limits.path("max_output_tokens").asInt(0)),
                    readUsage(node.path("usage")),
                    readStringMap(node.path("variables")),
                    node.path("http_error_handling").asBoolean(false),
                    text(node.get("notes")).map(String::trim));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Invalid model '" + key + "': " + ex.getMessage(), ex);
        }
    }

    private static Optional<AuthRequirement> readAuth(JsonNode auth) {
        if (!auth.isObject()) {
            return Optional.empty();
        }
        return Optional.of(new AuthRequirement(
                AuthType.from(auth.path("type").asText(null)),
                auth.path("key_name").asText(null),
                text(auth.get("prefix")),
                text(auth.get("env")),
                text(auth.get("help_url"))));
    }

    private static Map<String, UsageSpec> readUsage(JsonNode usage) {
        Map<String, UsageSpec> result = new LinkedHashMap<>();
        if (!usage.isObject()) {
            return result;
        }
        usage.fields().forEachRemaining(category -> result.put(category.getKey(), new UsageSpec(
                text(category.getValue().get("total")),
                readStringMap(category.getValue().path("breakdown")))));
        return result;
    }

    private static Map<String, String> readStringMap(JsonNode node) {
        Map<String, String> result = new LinkedHashMap<>();
        if (node.isObject()) {
            node.fields().forEachRemaining(field -> result.put(field.getKey(), field.getValue().asText()));
        }
        return result;
    }

    private static Optional<String> text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return Optional.empty();
        }
        return Optional.of(node.asText()).filter(value -> !value.isBlank());
    }
}
