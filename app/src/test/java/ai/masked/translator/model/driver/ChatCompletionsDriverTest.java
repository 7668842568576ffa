package ai.masked.translator.model.driver;

import static ai.masked.translator.model.driver.DriverFixtures.MAPPER;
import static ai.masked.translator.model.driver.DriverFixtures.PROMPTS;
import static ai.masked.translator.model.driver.DriverFixtures.config;
import static ai.masked.translator.model.driver.DriverFixtures.json;
import static ai.masked.translator.model.driver.DriverFixtures.wrapped;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.masked.translator.model.BodyType;
import ai.masked.translator.model.DriverOptions;
import ai.masked.translator.model.DriverRequest;
import ai.masked.translator.model.DriverResponse;
import ai.masked.translator.model.ModelConfig;
import ai.masked.translator.model.ModelDriver;
import ai.masked.translator.translate.MalformedResponseException;
import ai.masked.translator.translate.MarkersNotFoundException;
import ai.masked.translator.translate.MissingConfigException;
import ai.masked.translator.translate.TranslationFormat;
import ai.masked.translator.translate.TruncatedResponseException;
import ai.masked.translator.translate.VendorApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ChatCompletionsDriverTest {

    static Stream<Arguments> drivers() {
        return Stream.of(
                Arguments.of(new OpenAiDriver(PROMPTS, MAPPER), "OpenAI"),
                Arguments.of(new AnthropicDriver(PROMPTS, MAPPER), "Anthropic"),
                Arguments.of(new XaiDriver(PROMPTS, MAPPER), "Grok"));
    }

    @ParameterizedTest
    @MethodSource("drivers")
    void extractsTranslationBetweenMarkers(ModelDriver driver, String label) {
        DriverResponse response = driver.parseResponse(modelConfig(), completion(wrapped("Hallo @@0@@"), "stop"));

        assertThat(response.text()).isEqualTo("Hallo @@0@@");
        assertThat(response.usage()).map(usage -> usage.path("total_tokens").asInt()).contains(12);
    }

    @ParameterizedTest
    @MethodSource("drivers")
    void contentWithoutMarkersIsReported(ModelDriver driver, String label) {
        assertThatThrownBy(() -> driver.parseResponse(modelConfig(), completion("Hallo", "stop")))
                .isInstanceOf(MarkersNotFoundException.class)
                .hasMessage("Markers not found in " + label + " response");
    }

    @ParameterizedTest
    @MethodSource("drivers")
    void lengthFinishReasonMeansTruncated(ModelDriver driver, String label) {
        assertThatThrownBy(() -> driver.parseResponse(modelConfig(), completion(wrapped("Hal"), "length")))
                .isInstanceOf(TruncatedResponseException.class)
                .hasMessageContaining("finish_reason=length");
    }

    @ParameterizedTest
    @MethodSource("drivers")
    void missingContentIsMalformed(ModelDriver driver, String label) {
        assertThatThrownBy(() -> driver.parseResponse(modelConfig(), "{\"choices\":[]}"))
                .isInstanceOf(MalformedResponseException.class);
        assertThatThrownBy(() -> driver.parseResponse(modelConfig(), "not json"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageStartingWith("Invalid JSON response");
    }

    @ParameterizedTest
    @MethodSource("drivers")
    void buildsChatPayloadWithRenderedPrompt(ModelDriver driver, String label) {
        DriverOptions options = new DriverOptions(TranslationFormat.HTML, "translator", Optional.of("Docs site"),
                Optional.of("de"), Optional.of("fr"), Map.of());

        DriverRequest request = driver.buildRequest(modelConfig(), "Hallo", options);

        assertThat(request.bodyType()).isEqualTo(BodyType.JSON);
        assertThat(request.url()).isEqualTo("https://chat.test/v1");
        assertThat(request.headers()).containsEntry("Content-Type", "application/json").containsEntry("X-Extra", "1");
        JsonNode body = json(request.body());
        assertThat(body.path("model").asText()).isEqualTo("m-1");
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("system");
        assertThat(body.path("messages").get(0).path("content").asText())
                .contains("from de to fr", "Context: Docs site", MarkerProtocol.START)
                .doesNotContain("{source}", "{context}");
        assertThat(body.path("messages").get(1).path("content").asText()).isEqualTo(wrapped("Hallo"));
    }

    @Test
    void openAiErrorEnvelopeWins() {
        OpenAiDriver driver = new OpenAiDriver(PROMPTS, MAPPER);

        assertThatThrownBy(() -> driver.parseResponse(modelConfig(), "{\"error\":{\"message\":\"bad key\"}}"))
                .isInstanceOf(VendorApiException.class)
                .hasMessage("OpenAI API error: bad key");
    }

    @Test
    void anthropicExplainsMaxTokensErrors() {
        AnthropicDriver driver = new AnthropicDriver(PROMPTS, MAPPER);

        assertThatThrownBy(() -> driver.parseResponse(modelConfig(),
                "{\"error\":{\"type\":\"invalid_request_error\",\"message\":\"max_tokens: 99999 > 64000\"}}"))
                .isInstanceOf(VendorApiException.class)
                .hasMessageStartingWith("Requested max_tokens exceeds model limit.");
        assertThatThrownBy(() -> driver.parseResponse(modelConfig(), "{\"error\":{\"message\":\"overloaded\"}}"))
                .hasMessage("Anthropic API error: overloaded");
    }

    @Test
    void anthropicSendsDefaultMaxTokens() {
        AnthropicDriver driver = new AnthropicDriver(PROMPTS, MAPPER);

        DriverRequest request = driver.buildRequest(modelConfig(), "x", DriverOptions.of(TranslationFormat.TEXT));

        assertThat(json(request.body()).path("max_tokens").asInt()).isEqualTo(AnthropicDriver.DEFAULT_MAX_TOKENS);
    }

    @Test
    void xaiAcceptsStringAndObjectErrors() {
        XaiDriver driver = new XaiDriver(PROMPTS, MAPPER);

        assertThatThrownBy(() -> driver.parseResponse(modelConfig(), "{\"code\":\"401\",\"error\":\"Incorrect key\"}"))
                .isInstanceOf(VendorApiException.class)
                .hasMessage("Grok API error [401]: Incorrect key");
        assertThatThrownBy(() -> driver.parseResponse(modelConfig(), "{\"error\":{\"code\":\"rate\",\"message\":\"slow down\"}}"))
                .hasMessage("Grok API error [rate]: slow down");
    }

    @Test
    void xaiPayloadDisablesStreaming() {
        XaiDriver driver = new XaiDriver(PROMPTS, MAPPER);
        ModelConfig config = config("xai", "https://chat.test/v1", "{\"model\":\"grok-3\",\"max_tokens\":500}");

        JsonNode body = json(driver.buildRequest(config, "x", DriverOptions.of(TranslationFormat.TEXT)).body());

        assertThat(body.path("stream").asBoolean(true)).isFalse();
        assertThat(body.path("max_tokens").asInt()).isEqualTo(500);
    }

    @Test
    void missingModelNameFailsBeforeAnyRequest() {
        ModelConfig config = config("xai", "https://chat.test/v1", "{}");

        assertThatThrownBy(() -> new XaiDriver(PROMPTS, MAPPER).buildRequest(config, "x", DriverOptions.of(TranslationFormat.TEXT)))
                .isInstanceOf(MissingConfigException.class)
                .hasMessage("Missing xAI model name");
        assertThatThrownBy(() -> new OpenAiDriver(PROMPTS, MAPPER).buildRequest(config, "x", DriverOptions.of(TranslationFormat.TEXT)))
                .isInstanceOf(MissingConfigException.class)
                .hasMessage("Missing OpenAI model name");
    }

    private static ModelConfig modelConfig() {
        return config("openai", "https://chat.test/v1", "{\"model\":\"m-1\",\"temperature\":0.1}", Map.of("X-Extra", "1"));
    }

    private static String completion(String content, String finishReason) {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode choice = root.putArray("choices").addObject();
        choice.putObject("message").put("role", "assistant").put("content", content);
        choice.put("finish_reason", finishReason);
        root.putObject("usage").put("prompt_tokens", 8).put("completion_tokens", 4).put("total_tokens", 12);
        return root.toString();
    }
}
