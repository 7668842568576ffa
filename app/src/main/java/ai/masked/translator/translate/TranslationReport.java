package ai.masked.translator.translate;

import ai.masked.translator.filter.FilterStat;
import ai.masked.translator.model.UsageReport;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a successful run. {@code httpStatus} is 0 for a dry run.
 */
public record TranslationReport(
        String original,
        String prepared,
        String result,
        int httpStatus,
        String debugRequest,
        String debugResponse,
        String rawResponseBody,
        UsageReport consumed,
        TextLengths lengths,
        List<FilterStat> filterStats
) {

    public TranslationReport {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(prepared, "prepared");
        Objects.requireNonNull(result, "result");
        debugRequest = debugRequest == null ? "" : debugRequest;
        debugResponse = debugResponse == null ? "" : debugResponse;
        rawResponseBody = rawResponseBody == null ? "" : rawResponseBody;
        consumed = consumed == null ? UsageReport.EMPTY : consumed;
        Objects.requireNonNull(lengths, "lengths");
        filterStats = filterStats == null ? List.of() : List.copyOf(filterStats);
    }
}
