package com.smurthy.ai.advisor.agents;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smurthy.ai.advisor.model.NormalizedResponse;
import com.smurthy.ai.advisor.model.SourceRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a responder's payload into a {@link NormalizedResponse}.
 *
 * <ul>
 *   <li>non-JSON bodies become the answer text, with no sources;</li>
 *   <li>an inert {@code handoff} block is dropped;</li>
 *   <li>markdown code fences around top-level text fields are removed;</li>
 *   <li>the answer comes from the first of {@link #ANSWER_FIELDS};</li>
 *   <li>every list in {@link #SOURCE_FIELDS} is merged into one deduplicated source list.</li>
 * </ul>
 * Normalizing the payload of a normalized response ({@link #toPayload}) yields the same response.
 */
@Component
public class ResponseNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);

    static final List<String> ANSWER_FIELDS = List.of("reponse", "answer", "response", "explanation");
    static final List<String> SOURCE_FIELDS = List.of("sources", "sources_officielles", "references", "citations");

    private static final List<String> SOURCE_TITLE_FIELDS = List.of("titre", "title", "name", "nom");
    private static final List<String> SOURCE_URL_FIELDS = List.of("url", "lien", "link", "uri", "source_url");

    private static final String HANDOFF = "handoff";
    private static final Pattern FENCE = Pattern.compile("^```[\\w+-]*[ \\t]*\\n?(.*?)\\n?```$", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public ResponseNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public NormalizedResponse normalize(String rawBody) {
        Optional<ObjectNode> parsed = clean(rawBody);
        if (parsed.isEmpty()) {
            log.warn("Responder payload is not a JSON object, using it as plain answer text");
            return new NormalizedResponse(rawBody == null ? "" : stripFence(rawBody).strip(), List.of(), Map.of());
        }

        ObjectNode payload = parsed.get();
        String answer = "";
        List<SourceRef> sources = new ArrayList<>();
        Set<String> consumed = new LinkedHashSet<>();

        for (String field : ANSWER_FIELDS) {
            JsonNode value = payload.get(field);
            if (value != null && value.isTextual()) {
                consumed.add(field);
                if (answer.isBlank() && !value.asText().isBlank()) {
                    answer = value.asText();
                }
            }
        }
        for (String field : SOURCE_FIELDS) {
            JsonNode value = payload.get(field);
            if (value != null && (value.isArray() || value.isTextual())) {
                consumed.add(field);
                collectSources(value, sources);
            }
        }

        Map<String, JsonNode> extra = new LinkedHashMap<>();
        payload.fields().forEachRemaining(e -> {
            if (!consumed.contains(e.getKey())) {
                extra.put(e.getKey(), e.getValue());
            }
        });

        return new NormalizedResponse(answer, sources.stream().distinct().toList(), extra);
    }

    /**
     * Parse the payload and strip control metadata, keeping every other field in place.
     * Empty when the body is not a JSON object, even after removing a surrounding fence.
     */
    public Optional<ObjectNode> clean(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return Optional.empty();
        }
        Optional<ObjectNode> node = readObject(rawBody);
        if (node.isEmpty()) {
            node = readObject(stripFence(rawBody));
        }
        node.ifPresent(this::stripControlMetadata);
        return node;
    }

    /**
     * JSON form of a normalized response, in the canonical field names.
     */
    public ObjectNode toPayload(NormalizedResponse response) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put(freeKey(ANSWER_FIELDS, response), response.answerText());
        ArrayNode sources = payload.putArray(freeKey(SOURCE_FIELDS, response));
        for (SourceRef source : response.sources()) {
            ObjectNode entry = sources.addObject();
            entry.put("title", source.title());
            entry.put("url", source.url());
        }
        response.extraFields().forEach(payload::set);
        return payload;
    }

    // extra fields may hold a non-text alias under the same name, which must keep its value
    private static String freeKey(List<String> aliases, NormalizedResponse response) {
        return aliases.stream()
                .filter(name -> !response.extraFields().containsKey(name))
                .findFirst()
                .orElse(aliases.get(0));
    }

    /**
     * Remove one or more surrounding markdown code fences ({@code ```lang ... ```}).
     * Text without a fence is returned unchanged.
     */
    static String stripFence(String text) {
        String current = text;
        while (true) {
            String trimmed = current.strip();
            if (trimmed.length() < 6) {
                return current;
            }
            Matcher m = FENCE.matcher(trimmed);
            if (!m.matches()) {
                return current;
            }
            current = m.group(1).strip();
        }
    }

    private void stripControlMetadata(ObjectNode payload) {
        JsonNode handoff = payload.get(HANDOFF);
        if (handoff != null && isInert(handoff)) {
            payload.remove(HANDOFF);
            log.debug("Dropped inert handoff block");
        }

        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        List<String> fenced = new ArrayList<>();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isTextual() && !stripFence(field.getValue().asText()).equals(field.getValue().asText())) {
                fenced.add(field.getKey());
            }
        }
        for (String name : fenced) {
            payload.put(name, stripFence(payload.get(name).asText()));
        }
    }

    private static boolean isInert(JsonNode handoff) {
        if (handoff.isNull()) {
            return true;
        }
        if (!handoff.isObject()) {
            return false;
        }
        JsonNode needed = handoff.get("needed");
        if (needed != null && needed.isBoolean()) {
            return !needed.asBoolean();
        }
        String suggested = handoff.path("suggested_agent").asText(handoff.path("target_agent").asText(""));
        return "none".equals(suggested.strip().toLowerCase(Locale.ROOT));
    }

    private static void collectSources(JsonNode value, List<SourceRef> sink) {
        if (value.isTextual()) {
            sourceFromText(value.asText()).ifPresent(sink::add);
            return;
        }
        for (JsonNode entry : value) {
            if (entry.isTextual()) {
                sourceFromText(entry.asText()).ifPresent(sink::add);
            } else if (entry.isObject()) {
                String title = firstText(entry, SOURCE_TITLE_FIELDS);
                String url = firstText(entry, SOURCE_URL_FIELDS);
                if (title != null || url != null) {
                    sink.add(new SourceRef(title, url));
                }
            }
        }
    }

    private static Optional<SourceRef> sourceFromText(String text) {
        String value = text.strip();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        boolean isUrl = value.startsWith("http://") || value.startsWith("https://");
        return Optional.of(new SourceRef(value, isUrl ? value : null));
    }

    private static String firstText(JsonNode node, List<String> names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private Optional<ObjectNode> readObject(String text) {
        try {
            JsonNode node = objectMapper.readTree(text.strip());
            return node instanceof ObjectNode object ? Optional.of(object) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
