package com.extractpilot.orchestrator.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a JSON object from free-text LLM responses.
 *
 * Models answer with anything from clean JSON to prose wrapped around a
 * fenced block. Recovery runs an ordered list of strategies and stops at
 * the first one that yields a JSON object:
 *
 *   1. DIRECT            the whole response is the object
 *   2. STRIPPED_WRAPPER  the object sits inside ```json fences or a <result> tag
 *   3. BALANCED_BLOCK    the first brace-balanced {...} block anywhere in the text
 *
 * If none succeeds the caller gets Optional.empty() and decides what a parse
 * failure means for it (the judge turns it into an ESCALATE verdict).
 * Each strategy is public so it can be exercised on its own.
 */
public final class ResponseParser {

    public enum Strategy { DIRECT, STRIPPED_WRAPPER, BALANCED_BLOCK }

    /** A recovered object plus the strategy that found it. */
    public record Recovered(ObjectNode json, Strategy strategy) {}

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // ```json ... ``` or ``` ... ``` (language label optional)
    private static final Pattern FENCE = Pattern.compile(
            "```[a-zA-Z]*\\s*\\n?(.*?)```",
            Pattern.DOTALL
    );

    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Run every strategy in order and return the first JSON object found.
     */
    public static Optional<Recovered> recover(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        Optional<ObjectNode> direct = parseDirect(raw);
        if (direct.isPresent()) {
            return Optional.of(new Recovered(direct.get(), Strategy.DIRECT));
        }

        Optional<ObjectNode> stripped = stripWrapper(raw).flatMap(ResponseParser::parseDirect);
        if (stripped.isPresent()) {
            return Optional.of(new Recovered(stripped.get(), Strategy.STRIPPED_WRAPPER));
        }

        Optional<ObjectNode> block = extractBalancedBlock(raw).flatMap(ResponseParser::parseDirect);
        return block.map(json -> new Recovered(json, Strategy.BALANCED_BLOCK));
    }

    /**
     * Parse the text as-is. Only JSON objects count; arrays and scalars are rejected.
     */
    public static Optional<ObjectNode> parseDirect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(text.strip());
            return node instanceof ObjectNode obj ? Optional.of(obj) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Return the content of the first markdown fence, or of the first
     * {@code <result>} tag when there is no fence.
     */
    public static Optional<String> stripWrapper(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher fence = FENCE.matcher(text);
        if (fence.find()) {
            return Optional.of(fence.group(1).strip());
        }
        Matcher tag = RESULT_TAG.matcher(text);
        return tag.find() ? Optional.of(tag.group(1).strip()) : Optional.empty();
    }

    /**
     * Return the first brace-balanced {...} block that parses as a JSON object.
     *
     * Braces are paired in a single pass; braces inside string literals
     * (including escaped quotes) are ignored, and quotes outside any block
     * are treated as prose. Balanced blocks are then tried in order of their
     * opening brace, so an unclosed outer brace still lets a complete inner
     * object through.
     */
    public static Optional<String> extractBalancedBlock(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int[] closing = closingBraces(text);
        for (int start = text.indexOf('{'); start >= 0; start = text.indexOf('{', start + 1)) {
            int end = closing[start];
            if (end < 0) {
                continue;
            }
            String candidate = text.substring(start, end + 1);
            if (parseDirect(candidate).isPresent()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /** For every opening brace, the index of the brace that closes it; -1 elsewhere. */
    private static int[] closingBraces(String text) {
        int[] closing = new int[text.length()];
        Arrays.fill(closing, -1);
        Deque<Integer> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
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
            if (c == '"' && !open.isEmpty()) {
                inString = true;
            } else if (c == '{') {
                open.push(i);
            } else if (c == '}' && !open.isEmpty()) {
                closing[open.pop()] = i;
            }
        }
        return closing;
    }
}
