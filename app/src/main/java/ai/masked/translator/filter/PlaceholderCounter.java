package ai.masked.translator.filter;

import java.util.regex.Pattern;

/**
 * Issues {@code @@N@@} tokens with N starting at 0 and growing by one per token.
 * One counter is shared by all filters of a pipeline run.
 */
public final class PlaceholderCounter {

    /** Matches any token this class can issue. */
    public static final Pattern TOKEN_PATTERN = Pattern.compile("@@(\\d+)@@");

    private int issued;

    public String next() {
        return token(issued++);
    }

    /**
     * Number of tokens issued so far.
     */
    public int current() {
        return issued;
    }

    static String token(int index) {
        return "@@" + index + "@@";
    }

    public static boolean containsToken(String text) {
        return text != null && TOKEN_PATTERN.matcher(text).find();
    }
}
