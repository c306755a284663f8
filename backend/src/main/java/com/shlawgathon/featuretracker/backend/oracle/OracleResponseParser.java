package com.shlawgathon.featuretracker.backend.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code {"subtags": [...], "primary_hint": "..."}} from a model reply.
 * <p>
 * Tries, in order: the whole reply as JSON, the first fenced code block, then the first embedded object that
 * starts with a {@code subtags} field. Parsing is lenient about trailing commas, comments and single quotes.
 */
public class OracleResponseParser {

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final Pattern CODE_BLOCK = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);
    private static final Pattern SUBTAGS_OBJECT = Pattern.compile("\\{\\s*\"subtags\"\\s*:\\s*\\[.*?]\\s*(?:,[^{}]*)?}",
            Pattern.DOTALL);

    /**
     * Parsed proposal; an empty {@code subtags} list means "not a classifiable feature".
     */
    public record Proposal(List<String> subtags, String primaryHint) {
    }

    public Optional<Proposal> parse(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        String trimmed = response.trim();

        Optional<Proposal> direct = tryParse(trimmed);
        if (direct.isPresent()) {
            return direct;
        }

        Matcher block = CODE_BLOCK.matcher(trimmed);
        if (block.find()) {
            Optional<Proposal> fenced = tryParse(block.group(1));
            if (fenced.isPresent()) {
                return fenced;
            }
        }

        Matcher embedded = SUBTAGS_OBJECT.matcher(trimmed);
        if (embedded.find()) {
            return tryParse(embedded.group(0));
        }
        return Optional.empty();
    }

    private Optional<Proposal> tryParse(String json) {
        JsonNode root;
        try {
            root = LENIENT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode subtagsNode = root.get("subtags");
        if (subtagsNode == null || !subtagsNode.isArray()) {
            return Optional.empty();
        }

        List<String> subtags = new ArrayList<>();
        for (JsonNode item : subtagsNode) {
            if (item.isTextual()) {
                subtags.add(item.asText());
            } else if (item.isObject() && item.hasNonNull("name")) {
                subtags.add(item.get("name").asText());
            }
        }

        String hint = null;
        JsonNode hintNode = root.get("primary_hint");
        if (hintNode != null && hintNode.isTextual() && !hintNode.asText().isBlank()) {
            hint = hintNode.asText();
        }
        return Optional.of(new Proposal(subtags, hint));
    }
}
