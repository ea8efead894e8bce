package com.groceryai.infrastructure.ai.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the JSON payload inside free-form model text.
 * <p>
 * Strategies, first parseable candidate wins:
 * <ol>
 *   <li>a {@code ```json} fenced block</li>
 *   <li>any fenced block</li>
 *   <li>the whole text, when it opens with an array</li>
 *   <li>the first balanced {@code {...}} span (string literals are skipped when counting braces)</li>
 *   <li>the whole trimmed text</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonBlockLocator {

    private static final Pattern JSON_FENCE = Pattern.compile("```json\\s*([\\s\\S]*?)\\s*```");
    private static final Pattern ANY_FENCE = Pattern.compile("```\\s*([\\s\\S]*?)\\s*```");

    private final ObjectMapper objectMapper;

    public enum Strategy {
        JSON_FENCE,
        GENERIC_FENCE,
        BALANCED_OBJECT,
        WHOLE_TEXT
    }

    public record Located(JsonNode node, Strategy strategy) {}

    public Optional<Located> locate(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        Optional<Located> found = fromFence(JSON_FENCE, text, Strategy.JSON_FENCE);
        if (found.isPresent()) {
            return found;
        }
        found = fromFence(ANY_FENCE, text, Strategy.GENERIC_FENCE);
        if (found.isPresent()) {
            return found;
        }
        String trimmed = text.trim();
        // a bare top-level array would otherwise be located as its first element
        if (trimmed.startsWith("[")) {
            found = parse(trimmed).map(node -> new Located(node, Strategy.WHOLE_TEXT));
            if (found.isPresent()) {
                return found;
            }
        }
        found = fromBalancedObject(text);
        if (found.isPresent()) {
            return found;
        }
        return parse(trimmed).map(node -> new Located(node, Strategy.WHOLE_TEXT));
    }

    private Optional<Located> fromFence(Pattern fence, String text, Strategy strategy) {
        Matcher matcher = fence.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return parse(matcher.group(1).trim()).map(node -> new Located(node, strategy));
    }

    private Optional<Located> fromBalancedObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = findClosingBrace(text, start);
            if (end < 0) {
                return Optional.empty();
            }
            Optional<JsonNode> node = parse(text.substring(start, end + 1));
            if (node.isPresent()) {
                return Optional.of(new Located(node.get(), Strategy.BALANCED_OBJECT));
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    /**
     * @return index of the brace closing the one at {@code start}, or -1 when unbalanced
     */
    static int findClosingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private Optional<JsonNode> parse(String candidate) {
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(candidate);
            // bare scalars ("ok", 42) are not payloads
            if (node == null || !(node.isObject() || node.isArray())) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException e) {
            log.debug("Candidate is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
