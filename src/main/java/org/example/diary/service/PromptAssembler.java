package org.example.diary.service;

import org.example.diary.model.ReadingContent;
import org.example.diary.scripture.ResolvedReference;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the generation prompt for a day's reading.
 *
 * <p>The reading block lists, in order: the date, the citation (with its link), the body and,
 * only when the reading was enriched, the resolved Vietnamese text under its own label. Absent
 * optional fields are left out. Templates take the block through {@code {body}} and the date
 * through {@code {date}}; both placeholders are required.
 */
public class PromptAssembler {

    public static final String DATE_PLACEHOLDER = "{date}";
    public static final String BODY_PLACEHOLDER = "{body}";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(date|body)\\}");
    private static final Pattern INLINE_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\r]+");
    private static final Pattern EXTRA_BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final String TRUNCATION_SUFFIX = "...";

    private final String defaultTemplate;
    private final int maxBodyChars;

    public PromptAssembler(String defaultTemplate, int maxBodyChars) {
        validateTemplate(defaultTemplate);
        this.defaultTemplate = defaultTemplate;
        this.maxBodyChars = maxBodyChars;
    }

    public String assemble(ReadingContent content) {
        return assemble(content, defaultTemplate);
    }

    public String assemble(ReadingContent content, String template) {
        validateTemplate(template);
        String readingBlock = formatReading(content);

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder prompt = new StringBuilder();
        while (matcher.find()) {
            String value = "date".equals(matcher.group(1)) ? content.date() : readingBlock;
            matcher.appendReplacement(prompt, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(prompt);
        return prompt.toString();
    }

    String formatReading(ReadingContent content) {
        List<String> sections = new ArrayList<>();

        if (!content.date().isBlank()) {
            sections.add("Date: " + content.date());
        }

        content.citationText().ifPresent(citation -> sections.add(
                content.citationLinkUrl()
                        .map(link -> "Gospel: " + citation + " (" + link + ")")
                        .orElse("Gospel: " + citation)));

        String body = cleanBody(content.body());
        if (!body.isEmpty()) {
            sections.add(body);
        }

        content.resolved().ifPresent(reference -> sections.add(formatResolved(reference)));

        return String.join("\n\n", sections);
    }

    private static String formatResolved(ResolvedReference reference) {
        return "Vietnamese text (" + reference.reference() + "):\n" + reference.text();
    }

    private String cleanBody(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (String line : body.split("\n", -1)) {
            lines.add(INLINE_WHITESPACE.matcher(line).replaceAll(" ").trim());
        }
        String cleaned = EXTRA_BLANK_LINES.matcher(String.join("\n", lines)).replaceAll("\n\n").trim();
        if (maxBodyChars > 0 && cleaned.length() > maxBodyChars) {
            int end = maxBodyChars;
            if (Character.isHighSurrogate(cleaned.charAt(end - 1))) {
                end--;
            }
            cleaned = cleaned.substring(0, end) + TRUNCATION_SUFFIX;
        }
        return cleaned;
    }

    static void validateTemplate(String template) {
        if (template == null || template.isBlank()) {
            throw new PromptTemplateException("Prompt template is empty");
        }
        for (String placeholder : List.of(DATE_PLACEHOLDER, BODY_PLACEHOLDER)) {
            if (!template.contains(placeholder)) {
                throw new PromptTemplateException("Prompt template is missing the " + placeholder + " placeholder");
            }
        }
    }
}
