package com.smurthy.ai.advisor.service;

import com.smurthy.ai.advisor.config.ResponderConfig;
import com.smurthy.ai.advisor.config.RetrievalConfig;
import com.smurthy.ai.advisor.dto.ResponderAnswer;
import com.smurthy.ai.advisor.model.Document;
import com.smurthy.ai.advisor.model.ScoredDocument;
import com.smurthy.ai.advisor.retrieval.ContextAssembler;
import com.smurthy.ai.advisor.retrieval.DocumentCorpus;
import com.smurthy.ai.advisor.retrieval.SemanticRetriever;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Corpus-grounded responder for the "fiscalite" agent.
 *
 * Flow: corpus snapshot -> semantic retrieval -> bounded context -> generation. Generation runs
 * only when at least one document cleared the score threshold.
 */
@Service
public class KnowledgeResponder {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeResponder.class);

    static final String NO_INFORMATION = "Je n'ai pas trouvé d'information pertinente dans ma base "
            + "de connaissances pour répondre à cette question.";

    private static final String ANSWER_PROMPT = """
            Tu es un assistant fiscal spécialisé dans la fiscalité des PME françaises.

            Réponds uniquement à partir des documents ci-dessous. Si la réponse n'y figure pas,
            dis : "Je n'ai pas trouvé cette information dans ma base de connaissances."
            Cite le titre et l'URL des sources utilisées. Sois précis et structuré.

            DOCUMENTS :
            %s

            QUESTION :
            %s

            RÉPONSE :
            """;

    private final DocumentCorpus corpus;
    private final SemanticRetriever retriever;
    private final ContextAssembler contextAssembler;
    private final TextGenerator textGenerator;
    private final RetrievalConfig config;
    private final ResponderConfig responderConfig;

    public KnowledgeResponder(DocumentCorpus corpus,
                              SemanticRetriever retriever,
                              ContextAssembler contextAssembler,
                              TextGenerator textGenerator,
                              RetrievalConfig config,
                              ResponderConfig responderConfig) {
        this.corpus = corpus;
        this.retriever = retriever;
        this.contextAssembler = contextAssembler;
        this.textGenerator = textGenerator;
        this.config = config;
        this.responderConfig = responderConfig;
    }

    /**
     * Answer {@code question} from the corpus. Generation failures propagate to the caller.
     */
    public ResponderAnswer answer(String question) {
        List<Document> documents = corpus.load();
        if (documents.isEmpty()) {
            log.warn("Corpus is empty, answering without generation");
            return noInformation(question);
        }

        List<ScoredDocument> ranked = retriever.retrieve(question, documents, config.topK(), config.minScore());
        String context = contextAssembler.assemble(ranked, config.maxContextChars());
        if (ContextAssembler.NO_DOCUMENTS.equals(context)) {
            log.info("No document above {} for '{}'", config.minScore(), question);
            return noInformation(question);
        }

        long start = System.currentTimeMillis();
        String answer = textGenerator.generate(String.format(ANSWER_PROMPT, context, question),
                responderConfig.temperature(), responderConfig.maxTokens());
        log.info("Answered '{}' from {} document(s) in {}ms", question, ranked.size(), System.currentTimeMillis() - start);

        List<ResponderAnswer.Source> sources = ranked.stream()
                .limit(responderConfig.maxSources())
                .map(s -> new ResponderAnswer.Source(s.document().title(), s.document().sourceUrl()))
                .toList();
        return new ResponderAnswer(question, answer, ranked.size(), sources);
    }

    private static ResponderAnswer noInformation(String question) {
        return new ResponderAnswer(question, NO_INFORMATION, 0, null);
    }
}
