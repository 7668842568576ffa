package ai.masked.translator.translate;

import ai.masked.translator.http.SecretMasker;
import java.util.Optional;

/**
 * Root of the failures a translation run can raise. The pipeline attaches its
 * diagnostics once the exception leaves the stage that raised it.
 */
public class TranslationException extends RuntimeException {

    private PipelineDiagnostics diagnostics;
    private String redactedMessage;

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getMessage() {
        return redactedMessage != null ? redactedMessage : super.getMessage();
    }

    public Optional<PipelineDiagnostics> diagnostics() {
        return Optional.ofNullable(diagnostics);
    }

    public Optional<PipelineStage> stage() {
        return diagnostics().map(PipelineDiagnostics::stage);
    }

    /**
     * Attaches diagnostics unless an earlier stage already did.
     */
    public TranslationException withDiagnostics(PipelineDiagnostics value) {
        if (this.diagnostics == null) {
            this.diagnostics = value;
        }
        return this;
    }

    /**
     * Replaces known secrets in the message and in any vendor text this exception carries.
     */
    public TranslationException redact(SecretMasker masker) {
        redactedMessage = masker.mask(super.getMessage());
        return this;
    }
}
