package ai.masked.translator.filter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Regex-driven filter: every match becomes one token.
 */
abstract class PatternPlaceholderFilter implements PlaceholderFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(PatternPlaceholderFilter.class);

    private final String name;
    private final Pattern pattern;
    private final Map<String, String> captured = new LinkedHashMap<>();

    PatternPlaceholderFilter(String name, Pattern pattern) {
        this.name = Objects.requireNonNull(name, "name");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    @Override
    public String apply(String text, PlaceholderCounter counter) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        try {
            Matcher matcher = pattern.matcher(text);
            StringBuilder masked = new StringBuilder(text.length());
            Map<String, String> matched = new LinkedHashMap<>();
            while (matcher.find()) {
                String token = counter.next();
                matched.put(token, matcher.group());
                matcher.appendReplacement(masked, Matcher.quoteReplacement(token));
            }
            matcher.appendTail(masked);
            // only a complete scan is kept; tokens issued before a failure stay unused
            captured.putAll(matched);
            return masked.toString();
        } catch (StackOverflowError | RuntimeException ex) {
            LOGGER.warn("Filter {} could not scan input; leaving it unmasked", name, ex);
            return text;
        }
    }

    @Override
    public String restore(String text) {
        if (text == null || captured.isEmpty()) {
            return text;
        }
        Matcher matcher = PlaceholderCounter.TOKEN_PATTERN.matcher(text);
        StringBuilder restored = new StringBuilder(text.length());
        while (matcher.find()) {
            String original = captured.get(matcher.group());
            matcher.appendReplacement(restored, Matcher.quoteReplacement(original != null ? original : matcher.group()));
        }
        matcher.appendTail(restored);
        return restored.toString();
    }

    @Override
    public FilterStat stats() {
        return new FilterStat(name, captured.size());
    }
}
