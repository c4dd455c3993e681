package com.smurthy.ai.advisor.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.advisor.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Turns a stored JSON object into a {@link Document}.
 *
 * Accepts the French field names written by the ingestion pipeline
 * ({@code titre}, {@code contenu}, {@code source_url}) as well as English equivalents.
 */
@Component
public class DocumentParser {

    private static final Logger log = LoggerFactory.getLogger(DocumentParser.class);

    private static final String[] TITLE_FIELDS = {"titre", "titre_source", "title"};
    private static final String[] BODY_FIELDS = {"contenu", "content", "body"};
    private static final String[] URL_FIELDS = {"source_url", "url", "sourceUrl"};

    private final ObjectMapper objectMapper;

    public DocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the parsed document, or empty when the object is not JSON or carries no body text
     */
    public Optional<Document> parse(StoredObject object) {
        JsonNode node;
        try {
            node = objectMapper.readTree(object.rawBytes());
        } catch (IOException e) {
            log.warn("Skipping '{}': not valid JSON ({})", object.id(), e.getMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            log.warn("Skipping '{}': not a JSON object", object.id());
            return Optional.empty();
        }

        String body = firstText(node, BODY_FIELDS);
        if (body.isBlank()) {
            log.warn("Skipping '{}': no body text", object.id());
            return Optional.empty();
        }
        String title = firstText(node, TITLE_FIELDS);
        String url = firstText(node, URL_FIELDS);

        String id = node.hasNonNull("id") ? node.get("id").asText() : idFromSourceUrl(url, object.id());

        return Optional.of(new Document(id, title, body, url, body.length(), readEmbedding(node)));
    }

    /**
     * Stable id from a source URL: the last path segment (e.g. {@code F23570}),
     * else the first 8 hex chars of the URL's MD5.
     */
    public static String idFromSourceUrl(String sourceUrl, String fallbackKey) {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            return md5Prefix(fallbackKey);
        }
        try {
            String path = URI.create(sourceUrl.trim()).getPath();
            if (path != null) {
                String lastSegment = path.substring(path.lastIndexOf('/') + 1);
                if (!lastSegment.isBlank()) {
                    return lastSegment;
                }
            }
        } catch (IllegalArgumentException e) {
            log.debug("Source URL '{}' is not a URI, hashing it", sourceUrl);
        }
        return md5Prefix(sourceUrl);
    }

    private static String md5Prefix(String value) {
        return DigestUtils.md5DigestAsHex(value.getBytes(StandardCharsets.UTF_8)).substring(0, 8);
    }

    private static String firstText(JsonNode node, String[] fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return "";
    }

    private static float[] readEmbedding(JsonNode node) {
        JsonNode embedding = node.get("embedding");
        if (embedding == null || !embedding.isArray() || embedding.isEmpty()) {
            return null;
        }
        float[] vector = new float[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            JsonNode value = embedding.get(i);
            if (!value.isNumber()) {
                return null;
            }
            vector[i] = value.floatValue();
        }
        return vector;
    }
}
