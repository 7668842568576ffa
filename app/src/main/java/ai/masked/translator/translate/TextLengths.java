package ai.masked.translator.translate;

/**
 * Lengths in code points of the input, the masked text sent out, and the final result.
 */
public record TextLengths(int original, int prepared, int translated) {

    static int of(String text) {
        return text == null ? 0 : text.codePointCount(0, text.length());
    }
}
