package ai.masked.translator.validation;

import static org.assertj.core.api.Assertions.assertThat;

import ai.masked.translator.model.ModelLimits;
import org.junit.jupiter.api.Test;

class TextLengthValidatorTest {

    @Test
    void limitIsReducedByOverhead() {
        TextLengthValidator validator = new TextLengthValidator(100, 20);

        assertThat(validator.limitChars()).isEqualTo(80);
        assertThat(validator.validate("x".repeat(80)).valid()).isTrue();
        assertThat(validator.validate("x".repeat(81)).errors()).containsExactly(
                "Prepared text length 81 exceeds limit 80 by 1 chars (includes 20 overhead). "
                        + "Split input or reduce max output tokens.");
    }

    @Test
    void limitSmallerThanOverheadDisablesTheCheck() {
        TextLengthValidator validator = new TextLengthValidator(1000);

        assertThat(validator.limitChars()).isZero();
        assertThat(validator.validate("x".repeat(100_000)).valid()).isTrue();
    }

    @Test
    void countsCodePointsNotUtf16Units() {
        TextLengthValidator validator = new TextLengthValidator(3, 0);

        assertThat(validator.validate("😀😀😀").valid()).isTrue();
    }

    @Test
    void tokenBudgetCapsEstimatedCharacters() {
        TextLengthValidator validator = TextLengthValidator.fromModelLimits(new ModelLimits(60000, 16384, 0));

        // (16384 - 20% reserve) * 4 chars, minus the default overhead
        assertThat(validator.limitChars()).isEqualTo((16384 - 3276) * 4 - TextLengthValidator.DEFAULT_OVERHEAD_CHARS);
    }

    @Test
    void declaredOutputTokensReplaceTheReserve() {
        TextLengthValidator validator = TextLengthValidator.fromModelLimits(new ModelLimits(0, 10000, 2000), 20, 0);

        assertThat(validator.limitChars()).isEqualTo(32000);
    }

    @Test
    void noLimitsMeansNoCheck() {
        assertThat(TextLengthValidator.fromModelLimits(ModelLimits.NONE).validate("x".repeat(1_000_000)).valid()).isTrue();
    }
}
