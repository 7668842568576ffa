package ai.masked.translator.prompt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.masked.translator.translate.FormatNotFoundException;
import ai.masked.translator.translate.TemplateNotFoundException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PromptCatalogTest {

    private static final String YAML = """
            greeter:
              notes: says hello
              formats:
                text: "Hello {name}, from {source} to {target}. {missing}"
                html: "<p>{name}</p>"
            """;

    @Test
    void bundledCatalogCoversEveryFormat() {
        PromptCatalog catalog = PromptCatalog.loadDefault();

        assertThat(catalog.has("translator")).isTrue();
        assertThat(catalog.list().get("translator").formats()).containsExactly("text", "html", "json");
        assertThat(catalog.template("translator", "json"))
                .contains("{source}", "{target}", "{start}", "{end}", "{context}");
    }

    @Test
    void rendersKnownVariablesAndKeepsUnknownOnes() throws IOException {
        PromptCatalog catalog = load(YAML);

        String rendered = catalog.render("greeter", "text", Map.of("name", "Ann", "source", "de", "target", "{name}"));

        assertThat(rendered).isEqualTo("Hello Ann, from de to {name}. {missing}");
    }

    @Test
    void listsKindsWithNotes() throws IOException {
        PromptCatalog catalog = load(YAML);

        PromptInfo info = catalog.list().get("greeter");

        assertThat(info.formats()).containsExactly("text", "html");
        assertThat(info.notes()).contains("says hello");
        assertThat(catalog.kinds()).containsExactly("greeter");
    }

    @Test
    void missingKindAndFormatAreReportedSeparately() throws IOException {
        PromptCatalog catalog = load(YAML);

        assertThatThrownBy(() -> catalog.template("nope", "text"))
                .isInstanceOf(TemplateNotFoundException.class)
                .hasMessage("Prompt template 'nope' not found");
        assertThatThrownBy(() -> catalog.render("greeter", "json", Map.of()))
                .isInstanceOf(FormatNotFoundException.class)
                .hasMessageContaining("json");
    }

    private static PromptCatalog load(String yaml) throws IOException {
        return PromptCatalog.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}
