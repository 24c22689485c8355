package eu.virtualparadox.retrieval.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.*;
import eu.virtualparadox.retrieval.application.config.ApplicationConfig;
import eu.virtualparadox.retrieval.util.OrtInitializer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Local sentence-embedding model run through ONNX Runtime.
 * <p>
 * Expects {@code model.onnx} and {@code tokenizer.json} under {@code ${retrieval.models}/retriever}.
 * Token vectors are mean-pooled over the attention mask and L2-normalized.
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "retrieval.embedding", name = "provider", havingValue = "onnx", matchIfMissing = true)
public final class OnnxEmbeddingService implements EmbeddingService {

    private static final int MAX_LEN = 512;
    private static final int INTRA_OP_THREADS = 2;

    private final Path modelPath;
    private final Path tokenizerPath;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingService(final ApplicationConfig config) {
        final Path retrieverModelRoot = config.getModels().resolve("retriever");
        this.modelPath = retrieverModelRoot.resolve("model.onnx");
        this.tokenizerPath = retrieverModelRoot.resolve("tokenizer.json");
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        this.env = OrtEnvironment.getEnvironment();
        final OrtSession.SessionOptions options = OrtInitializer.initializeOrt(INTRA_OP_THREADS);

        this.session = env.createSession(modelPath.toString(), options);
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        log.info("Loaded ONNX embedding model: {}", modelPath);
        log.info("Model expects inputs: {}", session.getInputNames());
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (tokenizer != null) {
            tokenizer.close();
        }
        if (session != null) {
            session.close();
        }
    }

    @Override
    public float[] embedQuery(final String text) {
        try {
            final Encoding encoding = tokenizer.encode(text);
            final int len = Math.min(encoding.getIds().length, MAX_LEN);

            final long[][] inputIdArr = new long[1][len];
            final long[][] attnMaskArr = new long[1][len];
            final long[][] tokenTypeArr = new long[1][len];
            System.arraycopy(encoding.getIds(), 0, inputIdArr[0], 0, len);
            System.arraycopy(encoding.getAttentionMask(), 0, attnMaskArr[0], 0, len);

            try (final OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
                 final OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
                 final OnnxTensor tokenTypeTensor = OnnxTensor.createTensor(env, tokenTypeArr)) {

                final Map<String, OnnxTensor> inputs = new HashMap<>();
                if (session.getInputNames().contains("input_ids")) {
                    inputs.put("input_ids", inputIds);
                }
                if (session.getInputNames().contains("attention_mask")) {
                    inputs.put("attention_mask", attentionMask);
                }
                if (session.getInputNames().contains("token_type_ids")) {
                    inputs.put("token_type_ids", tokenTypeTensor);
                }

                try (final OrtSession.Result result = session.run(inputs)) {
                    final float[][][] embeddings = (float[][][]) result.get(0).getValue();
                    final float[] vec = meanPool(embeddings[0], attnMaskArr[0]);
                    normalize(vec);
                    return vec;
                }
            }
        } catch (final Exception e) {
            throw new IllegalStateException("Failed to embed query", e);
        }
    }

    private float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }

    private void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }
}
