package eu.virtualparadox.retrieval.rag.lexical;

import eu.virtualparadox.retrieval.rag.lexical.model.TermMatch;
import eu.virtualparadox.retrieval.rag.lexical.model.TokenizedChunk;
import eu.virtualparadox.retrieval.rag.text.ThaiText;
import eu.virtualparadox.retrieval.util.StringSimilarity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Matches a query term against the tokens of one chunk through a four-tier cascade.
 * <p>
 * Tiers are tried in order and the first tier with at least one matching token wins:
 * <ol>
 *   <li>exact token equality (or, for phrase terms, the exact token sequence)</li>
 *   <li>language-aware fuzzy equality: tone/vowel/space-insensitive for Thai terms,
 *       normalized Levenshtein similarity for everything else</li>
 *   <li>partial containment between term and token</li>
 *   <li>compound substring: containment or Thai character similarity per word of the term</li>
 * </ol>
 * Within the winning tier the quality is the best token quality and the term frequency counts all
 * tokens matching at that tier.
 */
@Component
public class TermMatcher {

    static final double THAI_SPACELESS_EQUAL = 0.95;
    static final double THAI_CONTAINMENT = 0.85;
    static final double THAI_MIN_SIMILARITY = 0.80;
    static final int THAI_MAX_LENGTH_GAP = 2;
    static final double GENERIC_MIN_SIMILARITY = 0.75;
    static final double PARTIAL_FLOOR = 0.6;
    static final double SUBSTRING_FLOOR = 0.5;
    static final double SUBSTRING_THAI_MIN_SIMILARITY = 0.7;
    static final int MIN_CONTAINMENT_LENGTH = 3;

    public Optional<TermMatch> match(final String term, final TokenizedChunk chunk) {
        if (term.isEmpty() || chunk.tokens().isEmpty()) {
            return Optional.empty();
        }

        final int exact = term.indexOf(' ') >= 0
                ? countSequence(term.split(" "), chunk.tokens())
                : chunk.counts().getOrDefault(term, 0);
        if (exact > 0) {
            return Optional.of(new TermMatch(MatchTier.EXACT, 1.0, exact));
        }

        final boolean thai = ThaiText.containsThai(term);
        final Optional<TermMatch> fuzzy = thai
                ? bestOf(MatchTier.LANGUAGE_FUZZY, chunk, token -> thaiFuzzy(term, token))
                : bestOf(MatchTier.GENERIC_FUZZY, chunk, token -> genericFuzzy(term, token));
        if (fuzzy.isPresent()) {
            return fuzzy;
        }

        final Optional<TermMatch> partial = bestOf(MatchTier.PARTIAL, chunk, token -> partial(term, token));
        if (partial.isPresent()) {
            return partial;
        }

        final List<String> parts = compoundParts(term);
        return bestOf(MatchTier.SUBSTRING, chunk, token -> compound(parts, token));
    }

    private Optional<TermMatch> bestOf(final MatchTier tier,
                                       final TokenizedChunk chunk,
                                       final ToDoubleFunction<String> quality) {
        double best = 0.0;
        int frequency = 0;
        for (final Map.Entry<String, Integer> entry : chunk.counts().entrySet()) {
            final double q = quality.applyAsDouble(entry.getKey());
            if (q > 0.0) {
                best = Math.max(best, q);
                frequency += entry.getValue();
            }
        }
        return frequency == 0 ? Optional.empty() : Optional.of(new TermMatch(tier, best, frequency));
    }

    double thaiFuzzy(final String term, final String token) {
        final String a = ThaiText.stripSpaces(term);
        final String b = ThaiText.stripSpaces(token);
        if (a.equals(b)) {
            return THAI_SPACELESS_EQUAL;
        }

        final String foldedA = ThaiText.fold(a);
        final String foldedB = ThaiText.fold(b);
        if (foldedA.isEmpty() || foldedB.isEmpty()) {
            return 0.0;
        }
        if (foldedA.equals(foldedB)) {
            return THAI_SPACELESS_EQUAL;
        }

        if (Math.min(a.length(), b.length()) >= MIN_CONTAINMENT_LENGTH && (a.contains(b) || b.contains(a))) {
            return THAI_CONTAINMENT;
        }

        if (Math.abs(a.length() - b.length()) <= THAI_MAX_LENGTH_GAP) {
            final double similarity = StringSimilarity.similarity(foldedA, foldedB);
            if (similarity >= THAI_MIN_SIMILARITY) {
                return similarity;
            }
        }
        return 0.0;
    }

    double genericFuzzy(final String term, final String token) {
        final double similarity = StringSimilarity.similarity(term, token);
        return similarity >= GENERIC_MIN_SIMILARITY ? similarity : 0.0;
    }

    double partial(final String term, final String token) {
        if (term.length() < MIN_CONTAINMENT_LENGTH || token.length() < MIN_CONTAINMENT_LENGTH) {
            return 0.0;
        }
        if (!term.contains(token) && !token.contains(term)) {
            return 0.0;
        }
        return Math.max(lengthRatio(term, token), PARTIAL_FLOOR);
    }

    double compound(final List<String> parts, final String token) {
        double best = 0.0;
        for (final String part : parts) {
            final boolean contained = token.contains(part)
                    || (token.length() >= MIN_CONTAINMENT_LENGTH && part.contains(token));
            if (contained) {
                best = Math.max(best, Math.max(lengthRatio(part, token), SUBSTRING_FLOOR));
            } else if (ThaiText.containsThai(part)) {
                final String foldedPart = ThaiText.fold(part);
                final String foldedToken = ThaiText.fold(token);
                if (!foldedPart.isEmpty() && !foldedToken.isEmpty()) {
                    final double similarity = StringSimilarity.similarity(foldedPart, foldedToken);
                    if (similarity > SUBSTRING_THAI_MIN_SIMILARITY) {
                        best = Math.max(best, similarity);
                    }
                }
            }
        }
        return best;
    }

    private static List<String> compoundParts(final String term) {
        final List<String> parts = new ArrayList<>();
        for (final String part : term.split("\\s+")) {
            if (part.length() >= MIN_CONTAINMENT_LENGTH) {
                parts.add(part);
            }
        }
        return parts;
    }

    private static double lengthRatio(final String a, final String b) {
        return Math.min(a.length(), b.length()) / (double) Math.max(a.length(), b.length());
    }

    private static int countSequence(final String[] words, final List<String> tokens) {
        int count = 0;
        outer:
        for (int i = 0; i + words.length <= tokens.size(); i++) {
            for (int j = 0; j < words.length; j++) {
                if (!tokens.get(i + j).equals(words[j])) {
                    continue outer;
                }
            }
            count++;
        }
        return count;
    }
}
