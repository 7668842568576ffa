package ai.masked.translator.prompt;

import ai.masked.translator.translate.ConfigurationException;
import ai.masked.translator.translate.FormatNotFoundException;
import ai.masked.translator.translate.TemplateNotFoundException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * System prompt templates keyed by kind and container format, loaded from YAML:
 *
 * <pre>
 * translator:
 *   formats:
 *     text: |
 *       Translate from {source} to {target} ...
 *   notes: optional description
 * </pre>
 */
public final class PromptCatalog {

    public static final String DEFAULT_RESOURCE = "prompts.yaml";

    private static final Pattern VARIABLE = Pattern.compile("\\{([A-Za-z0-9_]+)}");

    private final Map<String, Map<String, String>> templates;
    private final Map<String, String> notes;

    PromptCatalog(Map<String, Map<String, String>> templates, Map<String, String> notes) {
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
        this.notes = Map.copyOf(notes);
    }

    public static PromptCatalog loadDefault() {
        InputStream stream = PromptCatalog.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (stream == null) {
            throw new ConfigurationException("Prompt catalog resource not found: " + DEFAULT_RESOURCE);
        }
        try (InputStream in = stream) {
            return load(in);
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read prompt catalog " + DEFAULT_RESOURCE, ex);
        }
    }

    public static PromptCatalog load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Prompt catalog not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read prompt catalog " + path, ex);
        }
    }

    public static PromptCatalog load(InputStream in) throws IOException {
        JsonNode root = new ObjectMapper(new YAMLFactory()).readTree(in);
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Prompt catalog must be a mapping of prompt kinds");
        }
        Map<String, Map<String, String>> templates = new LinkedHashMap<>();
        Map<String, String> notes = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> kinds = root.fields(); kinds.hasNext(); ) {
            Map.Entry<String, JsonNode> kind = kinds.next();
            JsonNode formats = kind.getValue().path("formats");
            if (!formats.isObject()) {
                throw new ConfigurationException("Prompt '" + kind.getKey() + "' has no formats");
            }
            Map<String, String> byFormat = new LinkedHashMap<>();
            formats.fields().forEachRemaining(format -> byFormat.put(format.getKey(), format.getValue().asText()));
            templates.put(kind.getKey(), Collections.unmodifiableMap(byFormat));
            JsonNode note = kind.getValue().get("notes");
            if (note != null && !note.isNull() && !note.asText().isBlank()) {
                notes.put(kind.getKey(), note.asText().trim());
            }
        }
        return new PromptCatalog(templates, notes);
    }

    /**
     * Renders a template by replacing each {@code {name}} with its value in a single pass.
     * Placeholders without a value are kept as written.
     */
    public String render(String kind, String format, Map<String, String> variables) {
        String template = template(kind, format);
        Matcher matcher = VARIABLE.matcher(template);
        StringBuilder rendered = new StringBuilder(template.length() + 64);
        while (matcher.find()) {
            String value = variables.get(matcher.group(1));
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    public String template(String kind, String format) {
        Map<String, String> byFormat = templates.get(kind);
        if (byFormat == null) {
            throw new TemplateNotFoundException("Prompt template '" + kind + "' not found");
        }
        String template = byFormat.get(format);
        if (template == null) {
            throw new FormatNotFoundException("Prompt template '" + kind + "' has no format '" + format + "'");
        }
        return template;
    }

    public Map<String, PromptInfo> list() {
        Map<String, PromptInfo> result = new LinkedHashMap<>();
        templates.forEach((kind, formats) ->
                result.put(kind, new PromptInfo(new ArrayList<>(formats.keySet()), Optional.ofNullable(notes.get(kind)))));
        return result;
    }

    public boolean has(String kind) {
        return templates.containsKey(kind);
    }

    List<String> kinds() {
        return List.copyOf(templates.keySet());
    }
}
