package com.smurthy.ai.advisor.retrieval;

import com.smurthy.ai.advisor.config.RetrievalConfig;
import com.smurthy.ai.advisor.model.Document;
import com.smurthy.ai.advisor.model.ScoredDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds the length-bounded context block injected into the answer prompt.
 *
 * Example output:
 * <pre>
 * --- Document 1 ---
 * Titre: La TVA
 * Source: https://entreprendre.service-public.fr/vosdroits/F23566
 * Contenu:
 * La TVA est un impot indirect sur la consommation.
 * </pre>
 */
@Component
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    /** Returned for an empty ranking. Generation must not run on it. */
    public static final String NO_DOCUMENTS = "no documents";

    private static final String ELLIPSIS = "...";
    private static final String BLOCK_SEPARATOR = "\n";

    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[([^\\]]*)\\]\\([^)]*\\)");
    private static final Pattern HTML_ANCHOR = Pattern.compile("(?is)<a\\b[^>]*>(.*?)</a>");
    private static final Pattern RAW_URL = Pattern.compile("(?i)\\b(?:https?://|www\\.)\\S+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final RetrievalConfig config;

    public ContextAssembler(RetrievalConfig config) {
        this.config = config;
    }

    public String assemble(List<ScoredDocument> rankedDocs) {
        return assemble(rankedDocs, config.maxContextChars());
    }

    /**
     * Concatenate one block per document until {@code maxTotalChars} is reached.
     * A body is cut to {@code docBodyChars}, or to {@code docBodyFallbackChars} when the full
     * block would overflow the remaining budget.
     */
    public String assemble(List<ScoredDocument> rankedDocs, int maxTotalChars) {
        if (rankedDocs == null || rankedDocs.isEmpty()) {
            return NO_DOCUMENTS;
        }

        StringBuilder context = new StringBuilder();
        int included = 0;

        for (ScoredDocument scored : rankedDocs) {
            int remaining = maxTotalChars - context.length() - (included > 0 ? BLOCK_SEPARATOR.length() : 0);
            if (remaining <= 0) {
                break;
            }

            Document doc = scored.document();
            String cleaned = cleanBody(doc.bodyText());
            String block = block(included + 1, doc, truncate(cleaned, config.docBodyChars()));

            if (block.length() > remaining) {
                block = block(included + 1, doc, truncate(cleaned, config.docBodyFallbackChars()));
            }
            if (block.length() > remaining) {
                if (included > 0) {
                    break;
                }
                block = truncate(block, remaining - ELLIPSIS.length());
            }

            if (included > 0) {
                context.append(BLOCK_SEPARATOR);
            }
            context.append(block);
            included++;
        }

        log.debug("Assembled context from {} of {} document(s), {} chars",
                included, rankedDocs.size(), context.length());
        return context.toString();
    }

    /**
     * Strip hyperlink markup and bare URLs, then collapse whitespace.
     */
    String cleanBody(String body) {
        if (body == null || body.isEmpty()) {
            return "";
        }
        String text = HTML_ANCHOR.matcher(body).replaceAll("$1");
        text = MARKDOWN_LINK.matcher(text).replaceAll("$1");
        text = RAW_URL.matcher(text).replaceAll("");
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    /**
     * Cut at the last sentence end when it lies past {@code sentenceCutRatio} of the limit,
     * otherwise cut hard and append an ellipsis.
     */
    String truncate(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        if (limit <= 0) {
            return "";
        }
        String cut = text.substring(0, limit);
        int lastPeriod = cut.lastIndexOf('.');
        if (lastPeriod > config.sentenceCutRatio() * limit) {
            return cut.substring(0, lastPeriod + 1);
        }
        return cut.stripTrailing() + ELLIPSIS;
    }

    private static String block(int index, Document doc, String body) {
        String title = doc.title().isBlank() ? "Sans titre" : doc.title();
        String url = doc.sourceUrl() == null || doc.sourceUrl().isBlank() ? "URL non disponible" : doc.sourceUrl();
        return "--- Document " + index + " ---\n"
                + "Titre: " + title + "\n"
                + "Source: " + url + "\n"
                + "Contenu:\n"
                + body + "\n";
    }
}
