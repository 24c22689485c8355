package eu.virtualparadox.retrieval.rag.embed;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Delegates query embedding to a Spring AI {@link EmbeddingModel} supplied by the host application
 * (OpenAI, Ollama, ...). Selected with {@code retrieval.embedding.provider=spring-ai}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "retrieval.embedding", name = "provider", havingValue = "spring-ai")
public class SpringAiEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;

    @Override
    public float[] embedQuery(final String text) {
        final float[] vector;
        try {
            vector = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Embedding model call failed", e);
        }
        if (vector == null) {
            throw new IllegalStateException("Embedding model returned no vector");
        }
        log.debug("Embedded query into {} dimensions", vector.length);
        return vector;
    }
}
