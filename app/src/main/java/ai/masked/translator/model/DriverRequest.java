package ai.masked.translator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Wire request produced by a driver, before the credential is added.
 */
public record DriverRequest(String url, Map<String, String> headers, String body, BodyType bodyType) {

    public DriverRequest {
        Objects.requireNonNull(url, "url");
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? "" : body;
        Objects.requireNonNull(bodyType, "bodyType");
    }

    public DriverRequest withUrl(String value) {
        return new DriverRequest(value, headers, body, bodyType);
    }

    public DriverRequest withBody(String value) {
        return new DriverRequest(url, headers, value, bodyType);
    }

    public DriverRequest withHeader(String name, String value) {
        Map<String, String> updated = new LinkedHashMap<>(headers);
        updated.put(name, value);
        return new DriverRequest(url, updated, body, bodyType);
    }
}
