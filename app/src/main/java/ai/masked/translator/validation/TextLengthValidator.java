package ai.masked.translator.validation;

import ai.masked.translator.model.ModelLimits;

/**
 * Rejects prepared text longer than a model can take in one request. The configured limit
 * is reduced by a fixed overhead for the prompt and markers; a resulting limit of zero
 * disables the check.
 */
public final class TextLengthValidator implements ContentValidator {

    public static final int DEFAULT_OVERHEAD_CHARS = 2000;
    public static final int DEFAULT_OUTPUT_RESERVE_PERCENT = 20;
    static final int CHARS_PER_TOKEN = 4;

    private final int limitChars;
    private final int overheadChars;

    public TextLengthValidator(int limitChars) {
        this(limitChars, DEFAULT_OVERHEAD_CHARS);
    }

    public TextLengthValidator(int limitChars, int overheadChars) {
        this.overheadChars = Math.max(0, overheadChars);
        this.limitChars = Math.max(0, limitChars - this.overheadChars);
    }

    /**
     * Derives the limit from declared model limits. When a token budget is known, the input
     * share (total minus the output reserve, about four characters per token) caps the
     * estimated character limit.
     */
    public static TextLengthValidator fromModelLimits(ModelLimits limits) {
        return fromModelLimits(limits, DEFAULT_OUTPUT_RESERVE_PERCENT, DEFAULT_OVERHEAD_CHARS);
    }

    public static TextLengthValidator fromModelLimits(ModelLimits limits, int reservePercent, int overheadChars) {
        int limitChars = limits.estimatedMaxChars();
        if (limits.maxTokens() > 0) {
            int reservedOutput = limits.maxOutputTokens() > 0
                    ? limits.maxOutputTokens()
                    : Math.max(1, limits.maxTokens() * reservePercent / 100);
            long charsByTokens = (long) Math.max(0, limits.maxTokens() - reservedOutput) * CHARS_PER_TOKEN;
            int tokenLimit = (int) Math.min(Integer.MAX_VALUE, charsByTokens);
            limitChars = limitChars > 0 ? Math.min(limitChars, tokenLimit) : tokenLimit;
        }
        return new TextLengthValidator(limitChars, overheadChars);
    }

    @Override
    public ValidationResult validate(String content) {
        String text = content == null ? "" : content;
        int length = text.codePointCount(0, text.length());
        if (limitChars > 0 && length > limitChars) {
            return ValidationResult.failure(String.format(
                    "Prepared text length %d exceeds limit %d by %d chars (includes %d overhead). "
                            + "Split input or reduce max output tokens.",
                    length, limitChars, length - limitChars, overheadChars));
        }
        return ValidationResult.success();
    }

    public int limitChars() {
        return limitChars;
    }
}
