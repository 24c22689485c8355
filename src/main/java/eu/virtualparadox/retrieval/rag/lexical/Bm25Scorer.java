package eu.virtualparadox.retrieval.rag.lexical;

import eu.virtualparadox.retrieval.application.config.SearchConfig;
import eu.virtualparadox.retrieval.rag.lexical.model.LexicalMatch;
import eu.virtualparadox.retrieval.rag.lexical.model.TermMatch;
import eu.virtualparadox.retrieval.rag.lexical.model.TokenizedChunk;
import eu.virtualparadox.retrieval.rag.text.TextNormalizer;
import eu.virtualparadox.retrieval.store.model.Chunk;
import eu.virtualparadox.retrieval.store.model.ChunkKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Okapi BM25 over the candidate chunks of one query, with fuzzy term matching.
 * <p>
 * Steps:
 * <ol>
 *   <li>Tokenize every candidate once (no segmentation) and compute the average chunk length</li>
 *   <li>Match each distinct query term against each chunk via {@link TermMatcher}; document frequency
 *       counts the chunks with any qualifying match</li>
 *   <li>Sum {@code idf * tfSaturation * quality * tierDiscount} over the matched terms of each chunk</li>
 * </ol>
 * The idf variant {@code ln(1 + (N - df + 0.5) / (df + 0.5))} stays positive even for terms present in
 * most chunks. Chunks without any qualifying term are left out of the result.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class Bm25Scorer {

    private final TextNormalizer normalizer;
    private final TermMatcher termMatcher;
    private final SearchConfig config;

    /**
     * Scores candidates against the query terms.
     *
     * @param queryTokens normalized query terms (duplicates are ignored)
     * @param candidates  chunks in scope
     * @return lexical matches keyed by chunk, in candidate order; absent chunks did not match
     */
    public Map<ChunkKey, LexicalMatch> score(final List<String> queryTokens, final List<Chunk> candidates) {
        if (queryTokens.isEmpty() || candidates.isEmpty()) {
            return Map.of();
        }

        final List<String> terms = List.copyOf(new LinkedHashSet<>(queryTokens));
        final List<TokenizedChunk> docs = candidates.stream()
                .map(c -> TokenizedChunk.of(c, normalizer.tokenize(c.content())))
                .toList();

        final double avgLength = Math.max(1.0, docs.stream().mapToInt(TokenizedChunk::length).average().orElse(1.0));

        // first pass: per-chunk matches and document frequencies
        final List<Map<String, TermMatch>> matches = new ArrayList<>(docs.size());
        final Map<String, Integer> documentFrequency = new HashMap<>();
        for (final TokenizedChunk doc : docs) {
            final Map<String, TermMatch> docMatches = new LinkedHashMap<>();
            for (final String term : terms) {
                termMatcher.match(term, doc).ifPresent(m -> {
                    docMatches.put(term, m);
                    documentFrequency.merge(term, 1, Integer::sum);
                });
            }
            matches.add(docMatches);
        }

        log.debug("BM25: {} terms over {} chunks (avg length {}), df={}",
                terms.size(), docs.size(), String.format("%.1f", avgLength), documentFrequency);

        // second pass: BM25 contributions
        final int n = docs.size();
        final Map<ChunkKey, LexicalMatch> result = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            final Map<String, TermMatch> docMatches = matches.get(i);
            if (docMatches.isEmpty()) {
                continue;
            }

            final TokenizedChunk doc = docs.get(i);
            double score = 0.0;
            for (final Map.Entry<String, TermMatch> entry : docMatches.entrySet()) {
                final TermMatch m = entry.getValue();
                final double idf = idf(n, documentFrequency.get(entry.getKey()));
                score += idf * saturation(m.termFrequency(), doc.length(), avgLength) * m.weight();
            }

            if (score > 0.0) {
                result.put(doc.chunk().key(), new LexicalMatch(score, List.copyOf(docMatches.keySet())));
            }
        }
        return result;
    }

    double idf(final int totalChunks, final int documentFrequency) {
        return Math.log(1.0 + (totalChunks - documentFrequency + 0.5) / (documentFrequency + 0.5));
    }

    double saturation(final int tf, final int length, final double avgLength) {
        final double k1 = config.getBm25K1();
        final double b = config.getBm25B();
        return (tf * (k1 + 1)) / (tf + k1 * (1 - b + b * (length / avgLength)));
    }
}
