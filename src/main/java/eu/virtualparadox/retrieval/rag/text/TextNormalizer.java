package eu.virtualparadox.retrieval.rag.text;

import eu.virtualparadox.retrieval.application.config.TextConfig;
import eu.virtualparadox.retrieval.application.executor.RetrievalExecutor;
import eu.virtualparadox.retrieval.rag.text.segment.ThaiSegmenter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Turns raw text into lowercase tokens.
 * <p>
 * Two entry points share the same cleaning and splitting rules:
 * <ul>
 *   <li>{@link #normalize(String)} for query text: Thai-dense input is first passed through the
 *       {@link ThaiSegmenter} (time-bounded, falls back to the unsegmented text)</li>
 *   <li>{@link #tokenize(String)} for stored chunk text: never calls the segmenter, chunk text is
 *       segmented once at ingestion time</li>
 * </ul>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TextNormalizer {

    /** Whitespace runs and the fixed punctuation set that separates tokens. */
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-_,.!?()\\[\\]/\\\\:;\"']+");

    private final ThaiSegmenter segmenter;
    private final RetrievalExecutor executor;
    private final TextConfig config;

    /**
     * Normalizes query text, segmenting it first when its Thai density exceeds the configured threshold.
     * Never throws on segmenter trouble.
     *
     * @param text raw query text (may be null)
     * @return tokens in input order, possibly empty
     */
    public List<String> normalize(final String text) {
        if (StringUtils.isBlank(text)) {
            return List.of();
        }
        final String prepared = ThaiText.density(text) > config.getThaiDensityThreshold()
                ? segmentBounded(text)
                : text;
        return split(prepared);
    }

    /**
     * Tokenizes stored chunk text without segmentation.
     *
     * @param text chunk text (may be null)
     * @return tokens in text order, possibly empty
     */
    public List<String> tokenize(final String text) {
        if (StringUtils.isBlank(text)) {
            return List.of();
        }
        return split(text);
    }

    private List<String> split(final String text) {
        final String cleaned = text
                // zero-width and similar -> space
                .replaceAll("[\\u200B\\u200C\\u200D\\uFEFF]", " ")
                // non-breaking space -> space
                .replace('\u00A0', ' ')
                // soft hyphen -> remove
                .replace("\u00AD", "")
                // control chars (line breaks, tabs) -> space
                .replaceAll("\\p{Cc}", " ")
                .toLowerCase(Locale.ROOT);

        final List<String> tokens = new ArrayList<>();
        for (final String token : SEPARATORS.split(cleaned)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private String segmentBounded(final String text) {
        final long timeoutMs = config.getSegmenterTimeout().toMillis();
        final CompletableFuture<String> future;
        try {
            future = CompletableFuture.supplyAsync(() -> segmenter.segment(text), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Thai segmenter task rejected by the worker pool, using unsegmented text", e);
            return text;
        }
        try {
            final String segmented = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (StringUtils.isBlank(segmented)) {
                return text;
            }
            log.debug("Segmented query text: '{}' -> '{}'", text, segmented);
            return segmented;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Thai segmenter did not answer within {} ms, using unsegmented text", timeoutMs);
            return text;
        } catch (ExecutionException e) {
            log.warn("Thai segmenter failed, using unsegmented text", e.getCause());
            return text;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for Thai segmenter, using unsegmented text");
            return text;
        }
    }
}
