package ai.masked.translator.filter;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Protects whole {@code <tag ...>...</tag>} blocks for one tag name.
 * Matching is non-greedy, so a block containing a nested tag of the same name
 * ends at the first closing tag.
 */
public final class HtmlTagFilter extends PatternPlaceholderFilter {

    public static final String ID_PREFIX = "html_";

    private final String tag;

    public HtmlTagFilter(String tag) {
        super(ID_PREFIX + normalize(tag), compile(normalize(tag)));
        this.tag = normalize(tag);
    }

    public String tag() {
        return tag;
    }

    private static String normalize(String tag) {
        Objects.requireNonNull(tag, "tag");
        String trimmed = tag.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("tag must not be blank");
        }
        return trimmed;
    }

    private static Pattern compile(String tag) {
        String quoted = Pattern.quote(tag);
        return Pattern.compile("<" + quoted + "\\b.*?>.*?</" + quoted + "\\s*>",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }
}
