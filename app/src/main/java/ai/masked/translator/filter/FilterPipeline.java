package ai.masked.translator.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered set of filters sharing one counter. Masks in list order and restores in reverse,
 * so an outer filter gives back the inner filter's tokens before the inner filter runs.
 */
public final class FilterPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(FilterPipeline.class);

    private final List<PlaceholderFilter> filters;
    private final PlaceholderCounter counter = new PlaceholderCounter();

    public FilterPipeline(List<PlaceholderFilter> filters) {
        this.filters = List.copyOf(Objects.requireNonNull(filters, "filters"));
    }

    /**
     * Builds a pipeline from identifiers such as {@code url} or {@code html_a}.
     * Identifiers that name no known filter are skipped.
     */
    public static FilterPipeline fromIds(List<String> ids) {
        List<PlaceholderFilter> filters = new ArrayList<>();
        for (String raw : ids == null ? List.<String>of() : ids) {
            String id = raw == null ? "" : raw.trim();
            if (id.equals(UrlFilter.ID)) {
                filters.add(new UrlFilter());
            } else if (id.startsWith(HtmlTagFilter.ID_PREFIX) && id.length() > HtmlTagFilter.ID_PREFIX.length()) {
                filters.add(new HtmlTagFilter(id.substring(HtmlTagFilter.ID_PREFIX.length())));
            } else if (!id.isEmpty()) {
                LOGGER.debug("Ignoring unknown filter '{}'", id);
            }
        }
        return new FilterPipeline(filters);
    }

    public String apply(String text) {
        String current = text;
        for (PlaceholderFilter filter : filters) {
            current = filter.apply(current, counter);
        }
        return current;
    }

    public String restore(String text) {
        String current = text;
        ListIterator<PlaceholderFilter> iterator = filters.listIterator(filters.size());
        while (iterator.hasPrevious()) {
            current = iterator.previous().restore(current);
        }
        return current;
    }

    public List<FilterStat> stats() {
        return filters.stream().map(PlaceholderFilter::stats).toList();
    }

    public boolean isEmpty() {
        return filters.isEmpty();
    }

    public int issuedTokens() {
        return counter.current();
    }
}
