package ai.masked.translator.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.masked.translator.translate.TransportException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import mockwebserver3.MockResponse;
import mockwebserver3.MockWebServer;
import mockwebserver3.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdkHttpTransportTest {

    private static final String SECRET = "sk-secret-value";

    private MockWebServer server;
    private String baseUrl;
    private final JdkHttpTransport transport = new JdkHttpTransport();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        baseUrl = server.url("/v1/chat").toString();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.close();
    }

    @Test
    void postsBodyAndHeaders() throws Exception {
        server.enqueue(new MockResponse.Builder()
                .code(200)
                .setHeader("Content-Type", "application/json")
                .body("{\"ok\":true}")
                .build());

        HttpExchange exchange = transport.request(call(false, false));

        assertThat(exchange.status()).isEqualTo(200);
        assertThat(exchange.body()).isEqualTo("{\"ok\":true}");
        assertThat(exchange.debugRequest()).isEmpty();
        assertThat(exchange.debugResponse()).isEmpty();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getTarget()).isEqualTo("/v1/chat");
        assertThat(request.getHeaders().get("Authorization")).isEqualTo("Bearer " + SECRET);
        assertThat(request.getBody().utf8()).isEqualTo("{\"q\":\"" + SECRET + "\"}");
    }

    @Test
    void errorStatusIsReturnedNotThrown() {
        server.enqueue(new MockResponse.Builder().code(503).body("busy").build());

        HttpExchange exchange = transport.request(call(false, false));

        assertThat(exchange.status()).isEqualTo(503);
        assertThat(exchange.body()).isEqualTo("busy");
    }

    @Test
    void verboseDebugOutputIsMasked() {
        server.enqueue(new MockResponse.Builder().code(200).body("echo " + SECRET).build());

        HttpExchange exchange = transport.request(call(false, true));

        assertThat(exchange.debugRequest()).startsWith("[Request]").contains("Bearer ***").doesNotContain(SECRET);
        assertThat(exchange.debugResponse()).startsWith("[Response (200)]").contains("echo ***").doesNotContain(SECRET);
        assertThat(exchange.body()).isEqualTo("echo " + SECRET);
    }

    @Test
    void dryRunSendsNothing() {
        HttpExchange exchange = transport.request(call(true, false));

        assertThat(exchange.status()).isZero();
        assertThat(exchange.body()).isEqualTo(JdkHttpTransport.DRY_RUN_BODY);
        assertThat(exchange.debugRequest())
                .startsWith("[Dry-run: request (not sent)]")
                .contains(baseUrl)
                .doesNotContain(SECRET);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void connectionFailureBecomesTransportException() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        String deadUrl = stopped.url("/gone").toString();
        stopped.close();
        HttpCall call = new HttpCall("POST", deadUrl, "{}", Map.of(), Optional.empty(), false, false, List.of());

        assertThatThrownBy(() -> transport.request(call))
                .isInstanceOf(TransportException.class)
                .hasMessageStartingWith("Network error")
                .satisfies(ex -> assertThat(((TransportException) ex).status()).isZero());
    }

    private HttpCall call(boolean dryRun, boolean verbose) {
        return new HttpCall("POST", baseUrl, "{\"q\":\"" + SECRET + "\"}",
                Map.of("Authorization", "Bearer " + SECRET, "Content-Type", "application/json"),
                Optional.empty(), dryRun, verbose, List.of(SECRET));
    }
}
