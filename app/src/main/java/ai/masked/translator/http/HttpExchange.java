package ai.masked.translator.http;

import java.util.List;
import java.util.Map;

/**
 * Result of an {@link HttpCall}. Status is 0 when nothing was sent. The debug strings are
 * empty unless the call was verbose or a dry run, and never contain the call's secrets.
 */
public record HttpExchange(
        int status,
        Map<String, List<String>> headers,
        String body,
        String debugRequest,
        String debugResponse
) {

    public HttpExchange {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? "" : body;
        debugRequest = debugRequest == null ? "" : debugRequest;
        debugResponse = debugResponse == null ? "" : debugResponse;
    }
}
