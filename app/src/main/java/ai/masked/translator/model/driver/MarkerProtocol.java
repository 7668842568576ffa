package ai.masked.translator.model.driver;

import ai.masked.translator.translate.MarkersNotFoundException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sentinel strings wrapped around the document sent to chat vendors. The model is asked to
 * echo them around its translation so the reply can be cut out reliably.
 */
public final class MarkerProtocol {

    public static final String START = "‹‹TRANSLATION››";
    public static final String END = "‹‹END››";

    private static final Pattern SPAN = Pattern.compile(Pattern.quote(START) + "(.*?)" + Pattern.quote(END), Pattern.DOTALL);

    private MarkerProtocol() {
    }

    public static String wrap(String text) {
        return START + "\n" + text + "\n" + END;
    }

    /**
     * Returns the trimmed text between the first START and the END that follows it.
     */
    public static String extract(String content, String vendorLabel, String rawBody) {
        Matcher matcher = SPAN.matcher(content);
        if (!matcher.find()) {
            throw new MarkersNotFoundException("Markers not found in " + vendorLabel + " response", rawBody);
        }
        return matcher.group(1).trim();
    }
}
