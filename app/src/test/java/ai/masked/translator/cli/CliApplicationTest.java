package ai.masked.translator.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.masked.translator.config.ConfigLoader;
import ai.masked.translator.http.JdkHttpTransport;
import ai.masked.translator.model.driver.MarkerProtocol;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import mockwebserver3.MockResponse;
import mockwebserver3.MockWebServer;
import mockwebserver3.RecordedRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void dryRunWritesMaskedRoundTripToOutputFile() throws IOException {
        Path source = tempDir.resolve("page.html");
        Path target = tempDir.resolve("out/page.de.html");
        String html = "<p>See <a href=\"https://example.com\">docs</a> and https://other.example</p>";
        Files.writeString(source, html, StandardCharsets.UTF_8);

        int exitCode = application(Map.of(), "").run(new String[] {
                "--model", "openai:gpt-4o",
                "--format", "html",
                "--filters", "url,html_a",
                "--source", source.toString(),
                "--translated", target.toString(),
                "--dry-run"
        });

        assertThat(exitCode).isZero();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo(html);
        assertThat(err.toString())
                .contains("[Dry-run: request (not sent)]")
                .contains("url:\t2 placeholder(s)")
                .contains("html_a:\t1 placeholder(s)")
                .contains("Translation written to");
    }

    @Test
    void translatesStdinThroughConfiguredEndpoint() throws IOException, InterruptedException {
        try (MockWebServer server = new MockWebServer()) {
            server.start();
            Path models = tempDir.resolve("models.yaml");
            Files.writeString(models, """
                    local:
                      vendor: openai
                      endpoint: %s
                      requirements:
                        auth:
                          type: header
                          key_name: Authorization
                          prefix: Bearer
                          env: LOCAL_KEY
                      usage:
                        tokens:
                          total: total_tokens
                      models:
                        tiny:
                          defaults:
                            model: tiny-1
                    """.formatted(server.url("/v1/chat/completions")), StandardCharsets.UTF_8);
            server.enqueue(new MockResponse.Builder()
                    .code(200)
                    .setHeader("Content-Type", "application/json")
                    .body(completion(MarkerProtocol.wrap("Hallo @@0@@")))
                    .build());

            int exitCode = application(Map.of("LOCAL_KEY", "local-secret"), "Hello https://example.com").run(new String[] {
                    "--models-file", models.toString(),
                    "--model", "local:tiny",
                    "--filters", "url",
                    "--verbose"
            });

            assertThat(exitCode).isZero();
            assertThat(out.toString()).contains("Hallo https://example.com");
            assertThat(err.toString())
                    .contains("[Request]")
                    .contains("Bearer ***")
                    .doesNotContain("local-secret")
                    .contains("Tokens: 9");
            RecordedRequest request = server.takeRequest();
            assertThat(request.getHeaders().get("Authorization")).isEqualTo("Bearer local-secret");
            assertThat(request.getBody().utf8()).contains("@@0@@").doesNotContain("https://example.com");
        }
    }

    @Test
    void failedRunPrintsErrorAndDiagnostics() throws IOException {
        try (MockWebServer server = new MockWebServer()) {
            server.start();
            Path models = tempDir.resolve("models.yaml");
            Files.writeString(models, """
                    plain:
                      vendor: openai
                      endpoint: %s
                      defaults:
                        model: m
                    """.formatted(server.url("/chat")), StandardCharsets.UTF_8);
            server.enqueue(new MockResponse.Builder().code(200).body(completion("no markers here")).build());

            int exitCode = application(Map.of(), "Hello").run(new String[] {
                    "--models-file", models.toString(), "--model", "plain"
            });

            assertThat(exitCode).isEqualTo(1);
            assertThat(err.toString())
                    .contains("Error: Markers not found in OpenAI response")
                    .contains("stage=PARSE_RESPONSE");
        }
    }

    @Test
    void listsModelsGroupedByVendor() {
        int exitCode = application(Map.of(), "").run(new String[] {"--list-models"});

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("openai:")
                .contains("  openai:gpt-4o  [format=text, ~60000 chars]")
                .contains("deepl:free")
                .contains("yandex:gpt-pro");
    }

    @Test
    void listsPrompts() {
        int exitCode = application(Map.of(), "").run(new String[] {"--list-prompts"});

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("translator  [text, html, json]");
    }

    @Test
    void missingModelIsInvalidInput() {
        int exitCode = application(Map.of(), "Hello").run(new String[] {"--dry-run"});

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--model must be provided");
    }

    @Test
    void unknownOptionIsInvalidInput() {
        int exitCode = application(Map.of(), "").run(new String[] {"--bogus"});

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Unknown option");
    }

    @Test
    void blankInputIsRejected() {
        int exitCode = application(Map.of(), "  \n").run(new String[] {"--model", "openai:gpt-4o", "--dry-run"});

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Nothing to translate");
    }

    @Test
    void missingCredentialPointsToHelpPage() {
        int exitCode = application(Map.of(), "Hello").run(new String[] {"--model", "google:gemini-2.0-flash"});

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString())
                .contains("GOOGLE_API_KEY")
                .contains("Get an API key at https://aistudio.google.com/app/apikey");
    }

    private CliApplication application(Map<String, String> env, String stdin) {
        return new CliApplication(new ConfigLoader(key -> Optional.ofNullable(env.get(key))), new JdkHttpTransport(),
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)), new PrintWriter(out, true),
                new PrintWriter(err, true));
    }

    private static String completion(String content) {
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode root = mapper.createObjectNode();
        ObjectNode choice = root.putArray("choices").addObject();
        choice.putObject("message").put("role", "assistant").put("content", content);
        choice.put("finish_reason", "stop");
        root.putObject("usage").put("prompt_tokens", 6).put("completion_tokens", 3).put("total_tokens", 9);
        return root.toString();
    }
}
