package ai.masked.translator.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.masked.translator.model.driver.DriverFactory;
import ai.masked.translator.model.driver.YandexDriver;
import ai.masked.translator.prompt.PromptCatalog;
import ai.masked.translator.translate.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ModelRegistryTest {

    private static final DriverFactory DRIVERS = DriverFactory.standard(PromptCatalog.loadDefault(), new ObjectMapper());

    @Test
    void flattensVendorGroupsIntoQualifiedKeys() throws IOException {
        ModelRegistry registry = load("""
                acme:
                  vendor: openai
                  endpoint: https://acme.test/v1/chat
                  defaults:
                    temperature: 0.2
                    model: base
                  requirements:
                    auth:
                      type: header
                      key_name: Authorization
                      prefix: Bearer
                      env: ACME_KEY
                  models:
                    small:
                      defaults:
                        model: acme-small
                      limits:
                        estimated_max_chars: 1000
                    large:
                      endpoint: https://acme.test/v2/chat
                      notes: big one
                single:
                  vendor: deepl
                  endpoint: https://single.test
                  format: html
                """);

        assertThat(registry.list()).extracting(ModelConfig::key)
                .containsExactly("acme:large", "acme:small", "single");

        ModelConfig small = registry.require("acme:small");
        assertThat(small.vendor()).isEqualTo("openai");
        assertThat(small.defaultText("model")).contains("acme-small");
        assertThat(small.defaultDouble("temperature", 0.0)).isEqualTo(0.2);
        assertThat(registry.getCharLimit("acme:small")).isEqualTo(1000);
        assertThat(registry.getAuthEnv("acme:small")).contains("ACME_KEY");

        assertThat(registry.getEndpoint("acme:large")).isEqualTo("https://acme.test/v2/chat");
        assertThat(registry.getNotes("acme:large")).contains("big one");
        assertThat(registry.getCharLimit("acme:large")).isZero();
        assertThat(registry.getFormat("single")).isEqualTo("html");
    }

    @Test
    void vendorDefaultsToGroupName() throws IOException {
        ModelRegistry registry = load("""
                yandex:
                  endpoint: https://llm.test/completion
                  variables:
                    folder_id: FOLDER
                  models:
                    lite:
                      defaults:
                        model: lite/latest
                """);

        assertThat(registry.require("yandex:lite").vendor()).isEqualTo("yandex");
        assertThat(registry.getVariables("yandex:lite")).isEqualTo(Map.of("folder_id", "FOLDER"));
        assertThat(registry.getDriver("yandex:lite")).isInstanceOf(YandexDriver.class);
    }

    @Test
    void unknownKeyIsAConfigurationError() throws IOException {
        ModelRegistry registry = load("""
                m:
                  vendor: openai
                  endpoint: https://m.test
                """);

        assertThat(registry.has("nope")).isFalse();
        assertThat(registry.get("nope")).isEmpty();
        assertThatThrownBy(() -> registry.require("nope"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Unknown model key: nope");
    }

    @Test
    void entryWithoutEndpointIsRejected() {
        assertThatThrownBy(() -> load("""
                broken:
                  vendor: openai
                """))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("broken");
    }

    @Test
    void unknownVendorFailsWhenDriverIsRequested() throws IOException {
        ModelRegistry registry = load("""
                odd:
                  vendor: nobody
                  endpoint: https://odd.test
                """);

        assertThatThrownBy(() -> registry.getDriver("odd"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("No driver for vendor 'nobody'");
    }

    @Test
    void bundledRegistryHasEveryVendor() {
        ModelRegistry registry = ModelRegistry.loadDefault(DRIVERS);

        assertThat(registry.listByVendor().keySet())
                .containsExactly("anthropic", "deepl", "google", "openai", "xai", "yandex");
        assertThat(registry.getAuthEnv("deepl:free")).contains("DEEPL_FREE_API_KEY");
        assertThat(registry.getAuthEnv("deepl:pro")).contains("DEEPL_PRO_API_KEY");
        assertThat(registry.getFormat("deepl:pro")).isEqualTo("html");
        assertThat(registry.require("anthropic:claude-sonnet-4").httpErrorHandling()).isTrue();
        assertThat(registry.require("anthropic:claude-sonnet-4").headers()).containsEntry("Anthropic-Version", "2023-06-01");
        assertThat(registry.listByVendor().keySet()).containsAll(DRIVERS.vendors());
    }

    @Test
    void defaultsCannotBeChangedThroughTheConfig() {
        ModelRegistry registry = ModelRegistry.loadDefault(DRIVERS);
        ModelConfig config = registry.require("openai:gpt-4o");

        ((ObjectNode) config.defaults()).put("model", "tampered");

        assertThat(config.defaultText("model")).contains("gpt-4o");
        assertThat(registry.require("openai:gpt-4o").defaults().path("model").asText()).isEqualTo("gpt-4o");
    }

    @Test
    void deepMergeKeepsSiblingKeys() throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode base = (ObjectNode) mapper.readTree("{\"a\":{\"x\":1,\"y\":2},\"b\":1}");

        ModelRegistry.deepMerge(base, mapper.readTree("{\"a\":{\"y\":3},\"c\":true}"));

        assertThat(base.toString()).isEqualTo("{\"a\":{\"x\":1,\"y\":3},\"b\":1,\"c\":true}");
    }

    private static ModelRegistry load(String yaml) throws IOException {
        return ModelRegistry.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), DRIVERS);
    }
}
