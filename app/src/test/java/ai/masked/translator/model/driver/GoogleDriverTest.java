package ai.masked.translator.model.driver;

import static ai.masked.translator.model.driver.DriverFixtures.MAPPER;
import static ai.masked.translator.model.driver.DriverFixtures.PROMPTS;
import static ai.masked.translator.model.driver.DriverFixtures.config;
import static ai.masked.translator.model.driver.DriverFixtures.json;
import static ai.masked.translator.model.driver.DriverFixtures.wrapped;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.masked.translator.model.DriverOptions;
import ai.masked.translator.model.DriverResponse;
import ai.masked.translator.model.ModelConfig;
import ai.masked.translator.translate.MalformedResponseException;
import ai.masked.translator.translate.TranslationFormat;
import ai.masked.translator.translate.TruncatedResponseException;
import ai.masked.translator.translate.VendorApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

class GoogleDriverTest {

    private final GoogleDriver driver = new GoogleDriver(PROMPTS, MAPPER);
    private final ModelConfig config = config("google", "https://gemini.test/models/flash:generateContent",
            "{\"temperature\":0.0,\"maxOutputTokens\":2048,\"thinkingBudget\":0}");

    @Test
    void payloadCarriesSystemInstructionAndThinkingConfig() {
        JsonNode body = json(driver.buildRequest(config, "Hallo", DriverOptions.of(TranslationFormat.TEXT)).body());

        assertThat(body.path("system_instruction").path("parts").get(0).path("text").asText()).contains(MarkerProtocol.END);
        assertThat(body.path("contents").get(0).path("parts").get(0).path("text").asText()).isEqualTo(wrapped("Hallo"));
        assertThat(body.path("generationConfig").path("maxOutputTokens").asInt()).isEqualTo(2048);
        assertThat(body.path("generationConfig").path("thinkingConfig").path("thinkingBudget").asInt(-1)).isZero();
        assertThat(body.has("model")).isFalse();
    }

    @Test
    void joinsTextPartsAndSkipsThoughts() {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode candidate = root.putArray("candidates").addObject();
        ArrayNode parts = candidate.putObject("content").putArray("parts");
        parts.addObject().put("text", "thinking about it").put("thought", true);
        parts.addObject().put("text", MarkerProtocol.START + "\nBon");
        parts.addObject().put("text", "jour\n" + MarkerProtocol.END);
        candidate.put("finishReason", "STOP");
        root.putObject("usageMetadata").put("totalTokenCount", 40);

        DriverResponse response = driver.parseResponse(config, root.toString());

        assertThat(response.text()).isEqualTo("Bonjour");
        assertThat(response.usage()).isPresent();
    }

    @Test
    void maxTokensIsTruncation() {
        assertThatThrownBy(() -> driver.parseResponse(config,
                "{\"candidates\":[{\"content\":{\"parts\":[]},\"finishReason\":\"MAX_TOKENS\"}]}"))
                .isInstanceOf(TruncatedResponseException.class);
    }

    @Test
    void otherFinishReasonsAreMalformed() {
        assertThatThrownBy(() -> driver.parseResponse(config,
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"x\"}]},\"finishReason\":\"SAFETY\"}]}"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("SAFETY");
    }

    @Test
    void noCandidatesIsMalformed() {
        assertThatThrownBy(() -> driver.parseResponse(config, "{\"candidates\":[]}"))
                .isInstanceOf(MalformedResponseException.class);
    }

    @Test
    void errorEnvelopeIsVendorError() {
        assertThatThrownBy(() -> driver.parseResponse(config,
                "{\"error\":{\"code\":400,\"status\":\"INVALID_ARGUMENT\",\"message\":\"API key not valid\"}}"))
                .isInstanceOf(VendorApiException.class)
                .hasMessage("Gemini API error [INVALID_ARGUMENT]: API key not valid");
    }
}
