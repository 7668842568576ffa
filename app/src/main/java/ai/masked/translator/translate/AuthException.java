package ai.masked.translator.translate;

/**
 * No usable credential for the selected model.
 */
public class AuthException extends TranslationException {

    public AuthException(String message) {
        super(message);
    }
}
