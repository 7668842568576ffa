package ai.masked.translator.model;

/**
 * Encoding of a driver request body.
 */
public enum BodyType {
    JSON("application/json"),
    FORM("application/x-www-form-urlencoded");

    private final String contentType;

    BodyType(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }
}
