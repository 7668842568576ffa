package ai.masked.translator.http;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One outbound request. {@code secrets} lists values that must be masked in debug output.
 */
public record HttpCall(
        String method,
        String url,
        String body,
        Map<String, String> headers,
        Optional<URI> proxy,
        boolean dryRun,
        boolean verbose,
        List<String> secrets
) {

    public HttpCall {
        method = method == null || method.isBlank() ? "POST" : method;
        Objects.requireNonNull(url, "url");
        body = body == null ? "" : body;
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        proxy = proxy == null ? Optional.empty() : proxy;
        secrets = secrets == null ? List.of() : List.copyOf(secrets);
    }
}
