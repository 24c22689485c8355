package eu.virtualparadox.retrieval.rag.text;

import eu.virtualparadox.retrieval.application.config.TextConfig;
import eu.virtualparadox.retrieval.rag.text.model.SearchQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the lexical terms of a query.
 * <p>
 * Text between double quotes stays together as one phrase term; everything else is normalized word
 * by word. Stop words are removed from single-word terms and duplicates collapse to their first
 * occurrence. A query made only of stop words keeps them, so it still has something to match.
 */
@Component
@RequiredArgsConstructor
public class QueryAnalyzer {

    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    private final TextNormalizer normalizer;
    private final TextConfig config;

    public SearchQuery analyze(final String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return new SearchQuery(rawText, List.of());
        }

        final List<String> phrases = new ArrayList<>();
        final StringBuilder remainder = new StringBuilder();
        final Matcher matcher = QUOTED.matcher(rawText);
        int last = 0;
        while (matcher.find()) {
            remainder.append(rawText, last, matcher.start()).append(' ');
            final List<String> words = normalizer.normalize(matcher.group(1));
            if (!words.isEmpty()) {
                phrases.add(String.join(" ", words));
            }
            last = matcher.end();
        }
        remainder.append(rawText.substring(last));

        final Set<String> all = new LinkedHashSet<>(phrases);
        all.addAll(normalizer.normalize(remainder.toString()));

        final Set<String> stopWords = stopWords();
        final List<String> filtered = all.stream()
                .filter(term -> term.indexOf(' ') >= 0 || !stopWords.contains(term))
                .toList();

        return new SearchQuery(rawText, filtered.isEmpty() ? List.copyOf(all) : filtered);
    }

    private Set<String> stopWords() {
        final Set<String> words = new LinkedHashSet<>();
        for (final String word : config.getStopWords()) {
            words.add(word.toLowerCase(Locale.ROOT));
        }
        return words;
    }
}
