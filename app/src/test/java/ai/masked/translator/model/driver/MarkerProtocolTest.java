package ai.masked.translator.model.driver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.masked.translator.translate.MarkersNotFoundException;
import org.junit.jupiter.api.Test;

class MarkerProtocolTest {

    @Test
    void extractsTrimmedTextBetweenFirstMarkers() {
        String content = "Sure! " + MarkerProtocol.START + "\n  Hallo Welt \n" + MarkerProtocol.END
                + " and " + MarkerProtocol.START + "second" + MarkerProtocol.END;

        assertThat(MarkerProtocol.extract(content, "Test", "{}")).isEqualTo("Hallo Welt");
    }

    @Test
    void wrapPutsMarkersOnTheirOwnLines() {
        assertThat(MarkerProtocol.wrap("x")).isEqualTo(MarkerProtocol.START + "\nx\n" + MarkerProtocol.END);
    }

    @Test
    void missingEndMarkerFails() {
        assertThatThrownBy(() -> MarkerProtocol.extract(MarkerProtocol.START + " dangling", "OpenAI", "raw"))
                .isInstanceOf(MarkersNotFoundException.class)
                .hasMessage("Markers not found in OpenAI response")
                .satisfies(ex -> assertThat(((MarkersNotFoundException) ex).rawBody()).isEqualTo("raw"));
    }
}
