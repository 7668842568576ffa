package ai.masked.translator.filter;

import java.util.Objects;

/**
 * Number of spans a filter protected during one run.
 */
public record FilterStat(String filter, int count) {

    public FilterStat {
        Objects.requireNonNull(filter, "filter");
        if (count < 0) {
            throw new IllegalArgumentException("count must be zero or greater");
        }
    }
}
