package ai.masked.translator.model.driver;

import ai.masked.translator.model.ModelDriver;
import ai.masked.translator.prompt.PromptCatalog;
import ai.masked.translator.translate.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Resolves the vendor tag of a model configuration to its driver.
 */
public final class DriverFactory {

    private final Map<String, Supplier<ModelDriver>> constructors;

    public DriverFactory(Map<String, Supplier<ModelDriver>> constructors) {
        this.constructors = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(constructors, "constructors")));
    }

    public static DriverFactory standard(PromptCatalog prompts, ObjectMapper objectMapper) {
        Map<String, Supplier<ModelDriver>> constructors = new LinkedHashMap<>();
        constructors.put(AnthropicDriver.VENDOR, () -> new AnthropicDriver(prompts, objectMapper));
        constructors.put(DeepLDriver.VENDOR, () -> new DeepLDriver(objectMapper));
        constructors.put(GoogleDriver.VENDOR, () -> new GoogleDriver(prompts, objectMapper));
        constructors.put(OpenAiDriver.VENDOR, () -> new OpenAiDriver(prompts, objectMapper));
        constructors.put(XaiDriver.VENDOR, () -> new XaiDriver(prompts, objectMapper));
        constructors.put(YandexDriver.VENDOR, () -> new YandexDriver(prompts, objectMapper));
        return new DriverFactory(constructors);
    }

    public ModelDriver create(String vendor) {
        Supplier<ModelDriver> constructor = constructors.get(vendor);
        if (constructor == null) {
            throw new ConfigurationException("No driver for vendor '" + vendor + "'");
        }
        return constructor.get();
    }

    public Set<String> vendors() {
        return constructors.keySet();
    }
}
