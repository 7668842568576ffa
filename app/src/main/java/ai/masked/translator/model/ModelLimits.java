package ai.masked.translator.model;

/**
 * Size limits of a model. Zero means the limit is not declared.
 */
public record ModelLimits(int estimatedMaxChars, int maxTokens, int maxOutputTokens) {

    public static final ModelLimits NONE = new ModelLimits(0, 0, 0);

    public ModelLimits {
        if (estimatedMaxChars < 0 || maxTokens < 0 || maxOutputTokens < 0) {
            throw new IllegalArgumentException("limits must be zero or greater");
        }
    }
}
