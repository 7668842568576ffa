package ai.masked.translator.filter;

import java.util.regex.Pattern;

/**
 * Protects http, https, ftp and mailto URIs. A URI ends at whitespace or at one of {@code "<>()}.
 */
public final class UrlFilter extends PatternPlaceholderFilter {

    public static final String ID = "url";

    private static final Pattern URL_PATTERN =
            Pattern.compile("\\b(?:https?|ftp|mailto)://[^\\s\"<>()]+", Pattern.CASE_INSENSITIVE);

    public UrlFilter() {
        super(ID, URL_PATTERN);
    }
}
