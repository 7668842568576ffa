package ai.masked.translator.prompt;

import java.util.List;
import java.util.Optional;

/**
 * Formats a prompt kind supports, plus its optional notes.
 */
public record PromptInfo(List<String> formats, Optional<String> notes) {

    public PromptInfo {
        formats = formats == null ? List.of() : List.copyOf(formats);
        notes = notes == null ? Optional.empty() : notes;
    }
}
