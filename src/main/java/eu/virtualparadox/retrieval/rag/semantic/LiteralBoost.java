package eu.virtualparadox.retrieval.rag.semantic;

import eu.virtualparadox.retrieval.application.config.BoostConfig;
import eu.virtualparadox.retrieval.rag.text.ThaiText;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the literal boost a chunk earns for a given query.
 * <p>Comparison ignores case, Thai tone marks and the width of whitespace runs. Vowels are significant,
 * so a literal never matches a different word that merely shares its consonants.</p>
 */
@Component
@RequiredArgsConstructor
public class LiteralBoost {

    private static final int MIN_LITERAL_LENGTH = 2;

    private final BoostConfig config;

    /**
     * Boost terms mentioned by the query, each reduced to its literal-form variants.
     */
    public List<ActiveTerm> activeTerms(final String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank() || config.getTerms().isEmpty()) {
            return List.of();
        }
        final String queryForm = ThaiText.literalForm(rawQuery);

        final List<ActiveTerm> active = new ArrayList<>();
        for (final BoostConfig.BoostTerm term : config.getTerms()) {
            final List<String> variants = term.getVariants().stream()
                    .map(ThaiText::literalForm)
                    .filter(v -> v.length() >= MIN_LITERAL_LENGTH)
                    .toList();
            if (variants.stream().anyMatch(queryForm::contains)) {
                active.add(new ActiveTerm(variants, term.isPrimary() ? config.getPrimaryBoost() : config.getSecondaryBoost()));
            }
        }
        return active;
    }

    /**
     * Sum of the boosts of all active terms found in the chunk text.
     */
    public double boostFor(final List<ActiveTerm> activeTerms, final String chunkText) {
        if (activeTerms.isEmpty() || chunkText == null) {
            return 0.0;
        }
        final String textForm = ThaiText.literalForm(chunkText);
        double boost = 0.0;
        for (final ActiveTerm term : activeTerms) {
            if (term.variants().stream().anyMatch(textForm::contains)) {
                boost += term.boost();
            }
        }
        return boost;
    }

    public record ActiveTerm(List<String> variants, double boost) {
    }
}
