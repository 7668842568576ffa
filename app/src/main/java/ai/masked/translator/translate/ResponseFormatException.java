package ai.masked.translator.translate;

import ai.masked.translator.http.SecretMasker;

/**
 * The vendor answered, but not with something a translation can be read from.
 */
public class ResponseFormatException extends TranslationException {

    private String rawBody;

    public ResponseFormatException(String message, String rawBody) {
        super(message);
        this.rawBody = rawBody == null ? "" : rawBody;
    }

    public ResponseFormatException(String message, String rawBody, Throwable cause) {
        super(message, cause);
        this.rawBody = rawBody == null ? "" : rawBody;
    }

    public String rawBody() {
        return rawBody;
    }

    @Override
    public TranslationException redact(SecretMasker masker) {
        rawBody = masker.mask(rawBody);
        return super.redact(masker);
    }
}
