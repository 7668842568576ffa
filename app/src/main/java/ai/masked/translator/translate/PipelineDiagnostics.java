package ai.masked.translator.translate;

import java.util.Objects;

/**
 * Diagnostic context gathered by the pipeline up to the point a run stopped.
 * Request and response previews are already masked.
 */
public record PipelineDiagnostics(
        PipelineStage stage,
        int originalLength,
        int preparedLength,
        String debugRequest,
        String debugResponse,
        String rawResponseBody,
        int httpStatus
) {

    public PipelineDiagnostics {
        Objects.requireNonNull(stage, "stage");
        debugRequest = debugRequest == null ? "" : debugRequest;
        debugResponse = debugResponse == null ? "" : debugResponse;
        rawResponseBody = rawResponseBody == null ? "" : rawResponseBody;
    }

    public String describe() {
        StringBuilder builder = new StringBuilder();
        builder.append("stage=").append(stage)
                .append(" originalLength=").append(originalLength)
                .append(" preparedLength=").append(preparedLength);
        if (httpStatus > 0) {
            builder.append(" httpStatus=").append(httpStatus);
        }
        if (!debugRequest.isBlank()) {
            builder.append(System.lineSeparator()).append(debugRequest);
        }
        if (!debugResponse.isBlank()) {
            builder.append(System.lineSeparator()).append(debugResponse);
        }
        return builder.toString();
    }
}
