package ai.masked.translator.translate;

import ai.masked.translator.model.DriverOptions;
import ai.masked.translator.validation.RepairFeature;
import java.net.URI;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything one pipeline run needs besides the shared registry and transport.
 */
public record TranslationRequest(
        String text,
        String modelKey,
        TranslationFormat format,
        Optional<String> apiKey,
        List<String> filters,
        boolean dryRun,
        boolean verbose,
        Optional<String> context,
        String promptKey,
        Optional<String> sourceLang,
        Optional<String> targetLang,
        boolean validate,
        Map<String, String> variables,
        Optional<URI> proxy,
        Set<RepairFeature> repairs
) {

    public TranslationRequest {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(modelKey, "modelKey");
        format = format == null ? TranslationFormat.TEXT : format;
        apiKey = apiKey == null ? Optional.empty() : apiKey.filter(value -> !value.isBlank());
        filters = filters == null ? List.of() : List.copyOf(filters);
        context = context == null ? Optional.empty() : context;
        promptKey = promptKey == null || promptKey.isBlank() ? DriverOptions.DEFAULT_PROMPT_KEY : promptKey;
        sourceLang = sourceLang == null ? Optional.empty() : sourceLang;
        targetLang = targetLang == null ? Optional.empty() : targetLang;
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        proxy = proxy == null ? Optional.empty() : proxy;
        repairs = repairs == null || repairs.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(repairs));
    }

    public static Builder builder(String text, String modelKey) {
        return new Builder(text, modelKey);
    }

    public DriverOptions driverOptions() {
        return new DriverOptions(format, promptKey, context, sourceLang, targetLang, variables);
    }

    @Override
    public String toString() {
        return "TranslationRequest[modelKey=" + modelKey + ", format=" + format + ", length=" + text.length()
                + ", filters=" + filters + ", dryRun=" + dryRun + ", apiKey=" + (apiKey.isPresent() ? "***" : "none") + "]";
    }

    public static final class Builder {
        private final String text;
        private final String modelKey;
        private TranslationFormat format = TranslationFormat.TEXT;
        private Optional<String> apiKey = Optional.empty();
        private List<String> filters = List.of();
        private boolean dryRun;
        private boolean verbose;
        private Optional<String> context = Optional.empty();
        private String promptKey = DriverOptions.DEFAULT_PROMPT_KEY;
        private Optional<String> sourceLang = Optional.empty();
        private Optional<String> targetLang = Optional.empty();
        private boolean validate = true;
        private Map<String, String> variables = Map.of();
        private Optional<URI> proxy = Optional.empty();
        private Set<RepairFeature> repairs = Set.of();

        private Builder(String text, String modelKey) {
            this.text = text;
            this.modelKey = modelKey;
        }

        public Builder format(TranslationFormat value) {
            this.format = value;
            return this;
        }

        public Builder apiKey(String value) {
            this.apiKey = Optional.ofNullable(value);
            return this;
        }

        public Builder filters(List<String> value) {
            this.filters = value;
            return this;
        }

        public Builder dryRun(boolean value) {
            this.dryRun = value;
            return this;
        }

        public Builder verbose(boolean value) {
            this.verbose = value;
            return this;
        }

        public Builder context(String value) {
            this.context = Optional.ofNullable(value);
            return this;
        }

        public Builder promptKey(String value) {
            this.promptKey = value;
            return this;
        }

        public Builder sourceLang(String value) {
            this.sourceLang = Optional.ofNullable(value);
            return this;
        }

        public Builder targetLang(String value) {
            this.targetLang = Optional.ofNullable(value);
            return this;
        }

        public Builder validate(boolean value) {
            this.validate = value;
            return this;
        }

        public Builder variables(Map<String, String> value) {
            this.variables = value;
            return this;
        }

        public Builder proxy(URI value) {
            this.proxy = Optional.ofNullable(value);
            return this;
        }

        public Builder repairs(Set<RepairFeature> value) {
            this.repairs = value;
            return this;
        }

        public TranslationRequest build() {
            return new TranslationRequest(text, modelKey, format, apiKey, filters, dryRun, verbose, context,
                    promptKey, sourceLang, targetLang, validate, variables, proxy, repairs);
        }
    }
}
