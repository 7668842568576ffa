package ai.masked.translator.validation;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.jsoup.parser.ParseError;
import org.jsoup.parser.Parser;

/**
 * Structural HTML check built on jsoup's tree builder. Fragments are parsed inside a
 * {@code <div>}; only tree-construction errors such as stray or unclosed container tags
 * fail the check. Unknown element names and self-closed container tags such as
 * {@code <span/>} are accepted.
 */
public final class HtmlValidator implements ContentValidator {

    static final int MAX_REPORTED_ERRORS = 50;

    private static final Pattern SELF_CLOSING_WARNING = Pattern.compile("^Tag \\[[^\\]]+] cannot be self closing");
    private static final Pattern FULL_DOCUMENT = Pattern.compile("^\\s*<(?:!DOCTYPE|html)(?:\\s|>)", Pattern.CASE_INSENSITIVE);

    @Override
    public ValidationResult validate(String content) {
        String source = content == null ? "" : content;
        String html = FULL_DOCUMENT.matcher(source).find() ? source : "<div>" + source + "</div>";

        Parser parser = Parser.htmlParser().setTrackErrors(MAX_REPORTED_ERRORS);
        parser.parseInput(html, "");
        List<String> errors = parser.getErrors().stream()
                .filter(error -> !SELF_CLOSING_WARNING.matcher(error.getErrorMessage()).find())
                .map(HtmlValidator::describe)
                .collect(Collectors.toList());
        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    private static String describe(ParseError error) {
        return "HTML parse error at " + error.getPosition() + ": " + error.getErrorMessage();
    }
}
