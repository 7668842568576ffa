package ai.masked.translator.http;

import ai.masked.translator.translate.TransportException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HttpTransport} on top of {@code java.net.http.HttpClient}.
 */
public class JdkHttpTransport implements HttpTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpTransport.class);

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(120);
    static final String DRY_RUN_BODY = "[dry-run]";

    private final HttpClient httpClient;

    public JdkHttpTransport() {
        this(newClient(null));
    }

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public HttpExchange request(HttpCall call) {
        SecretMasker masker = new SecretMasker(call.secrets());
        if (call.dryRun()) {
            return new HttpExchange(0, Map.of(), DRY_RUN_BODY,
                    describeRequest("Dry-run: request (not sent)", call, masker), "");
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(call.url()))
                .timeout(REQUEST_TIMEOUT)
                .method(call.method(), HttpRequest.BodyPublishers.ofString(call.body(), StandardCharsets.UTF_8));
        call.headers().forEach(builder::header);

        HttpClient client = call.proxy().map(JdkHttpTransport::newClient).orElse(httpClient);
        String debugRequest = call.verbose() ? describeRequest("Request", call, masker) : "";
        LOGGER.debug("Sending {} {}", call.method(), masker.mask(call.url()));
        try {
            HttpResponse<String> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            LOGGER.debug("Received HTTP {} ({} chars)", response.statusCode(), response.body() == null ? 0 : response.body().length());
            String debugResponse = call.verbose() ? describeResponse(response, masker) : "";
            return new HttpExchange(response.statusCode(), response.headers().map(), response.body(), debugRequest, debugResponse);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for " + masker.mask(call.url()), ex);
        } catch (IOException ex) {
            throw new TransportException("Network error: " + masker.mask(String.valueOf(ex.getMessage())), ex);
        }
    }

    private static HttpClient newClient(URI proxy) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (proxy != null) {
            int port = proxy.getPort() > 0 ? proxy.getPort() : ("https".equalsIgnoreCase(proxy.getScheme()) ? 443 : 80);
            builder.proxy(ProxySelector.of(new InetSocketAddress(proxy.getHost(), port)));
        }
        return builder.build();
    }

    static String describeRequest(String title, HttpCall call, SecretMasker masker) {
        StringBuilder text = new StringBuilder();
        text.append("[").append(title).append("]").append(System.lineSeparator());
        text.append(call.method()).append(' ').append(masker.mask(call.url())).append(System.lineSeparator());
        call.headers().forEach((name, value) ->
                text.append(name).append(": ").append(masker.mask(value)).append(System.lineSeparator()));
        call.proxy().ifPresent(proxy -> text.append("Proxy: ").append(masker.mask(proxy.toString())).append(System.lineSeparator()));
        text.append(System.lineSeparator()).append(masker.mask(call.body()));
        return text.toString();
    }

    private static String describeResponse(HttpResponse<String> response, SecretMasker masker) {
        StringBuilder text = new StringBuilder();
        text.append("[Response (").append(response.statusCode()).append(")]").append(System.lineSeparator());
        response.headers().map().forEach((name, values) -> {
            for (String value : values) {
                text.append(name).append(": ").append(masker.mask(value)).append(System.lineSeparator());
            }
        });
        text.append(System.lineSeparator()).append(masker.mask(response.body()));
        return text.toString();
    }
}
