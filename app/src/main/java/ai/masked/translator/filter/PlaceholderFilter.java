package ai.masked.translator.filter;

/**
 * Replaces protected spans with placeholder tokens and puts them back afterwards.
 * An instance remembers the spans it captured, so it serves a single run.
 */
public interface PlaceholderFilter {

    /**
     * Replaces every non-overlapping match, left to right, with a token from {@code counter}.
     * Never throws; returns the input unchanged if matching fails.
     */
    String apply(String text, PlaceholderCounter counter);

    /**
     * Replaces the tokens this instance issued with their originals. Other tokens are left alone.
     */
    String restore(String text);

    FilterStat stats();
}
