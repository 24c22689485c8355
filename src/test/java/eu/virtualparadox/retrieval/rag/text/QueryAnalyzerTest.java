package eu.virtualparadox.retrieval.rag.text;

import eu.virtualparadox.retrieval.application.config.TextConfig;
import eu.virtualparadox.retrieval.application.executor.RetrievalExecutor;
import eu.virtualparadox.retrieval.rag.text.model.SearchQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryAnalyzerTest {

    private RetrievalExecutor executor;
    private QueryAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        executor = new RetrievalExecutor();
        executor.setCorePoolSize(2);
        executor.initialize();

        final TextConfig config = new TextConfig();
        // identity segmenter keeps the tests independent of the JRE dictionary
        analyzer = new QueryAnalyzer(new TextNormalizer(text -> text, executor, config), config);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Stop words are dropped from query terms")
    void testStopWordsAreDropped() {
        final SearchQuery query = analyzer.analyze("What is the price of XOLO?");

        assertThat(query.normalizedTokens()).containsExactly("what", "price", "xolo");
        assertThat(query.rawText()).isEqualTo("What is the price of XOLO?");
    }

    @Test
    @DisplayName("A query made only of stop words keeps its terms")
    void testOnlyStopWords() {
        assertThat(analyzer.analyze("to be or to be").normalizedTokens())
                .containsExactly("to", "be", "or");
    }

    @Test
    @DisplayName("Quoted text stays together as one phrase term")
    void testQuotedPhrase() {
        assertThat(analyzer.analyze("\"Opening Hours\" of xolo store").normalizedTokens())
                .containsExactly("opening hours", "xolo", "store");
    }

    @Test
    @DisplayName("Phrases keep their stop words")
    void testPhraseKeepsStopWords() {
        assertThat(analyzer.analyze("\"the menu\"").normalizedTokens()).containsExactly("the menu");
    }

    @Test
    @DisplayName("Duplicate terms collapse to the first occurrence")
    void testDuplicates() {
        assertThat(analyzer.analyze("xolo menu XOLO Menu").normalizedTokens()).containsExactly("xolo", "menu");
    }

    @Test
    @DisplayName("Blank query has no terms")
    void testBlankQuery() {
        assertThat(analyzer.analyze("  ").isEmpty()).isTrue();
        assertThat(analyzer.analyze(null).rawText()).isEmpty();
    }
}
