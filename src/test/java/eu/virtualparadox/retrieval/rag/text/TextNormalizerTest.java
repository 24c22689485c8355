package eu.virtualparadox.retrieval.rag.text;

import eu.virtualparadox.retrieval.application.config.TextConfig;
import eu.virtualparadox.retrieval.application.executor.RetrievalExecutor;
import eu.virtualparadox.retrieval.rag.text.segment.ThaiSegmenter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TextNormalizerTest {

    private static final String THAI = "สวัสดีครับ";

    @Mock
    private ThaiSegmenter segmenter;

    private RetrievalExecutor executor;
    private TextConfig config;
    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        executor = new RetrievalExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.initialize();

        config = new TextConfig();
        normalizer = new TextNormalizer(segmenter, executor, config);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Text is lowercased and split on whitespace and punctuation")
    void testSplitOnPunctuation() {
        assertThat(normalizer.tokenize("Hello, World!  foo-bar (baz)/qux"))
                .containsExactly("hello", "world", "foo", "bar", "baz", "qux");
        assertThat(normalizer.normalize("Opening hours: 9am-5pm"))
                .containsExactly("opening", "hours", "9am", "5pm");
        verifyNoInteractions(segmenter);
    }

    @Test
    @DisplayName("Invisible and non-breaking separators split tokens")
    void testInvisibleSeparators() {
        assertThat(normalizer.tokenize("a\u00A0b\u200Bc\tsoft\u00ADware"))
                .containsExactly("a", "b", "c", "software");
    }

    @Test
    @DisplayName("Blank input yields no tokens")
    void testBlankInput() {
        assertThat(normalizer.normalize("   ")).isEmpty();
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.tokenize("")).isEmpty();
    }

    @Test
    @DisplayName("Thai-dense query text is segmented before splitting")
    void testThaiQueryIsSegmented() {
        when(segmenter.segment(THAI)).thenReturn("สวัสดี ครับ");

        assertThat(normalizer.normalize(THAI)).containsExactly("สวัสดี", "ครับ");
        verify(segmenter).segment(THAI);
    }

    @Test
    @DisplayName("Text below the Thai density threshold is not segmented")
    void testLowDensityIsNotSegmented() {
        // 3 Thai characters out of 40
        assertThat(normalizer.normalize("Report about ไทย in plain English words"))
                .containsExactly("report", "about", "ไทย", "in", "plain", "english", "words");
        verifyNoInteractions(segmenter);
    }

    @Test
    @DisplayName("Chunk tokenization never calls the segmenter")
    void testTokenizeNeverSegments() {
        assertThat(normalizer.tokenize(THAI)).containsExactly(THAI);
        verifyNoInteractions(segmenter);
    }

    @Test
    @DisplayName("Segmenter failure falls back to the unsegmented text")
    void testSegmenterFailure() {
        when(segmenter.segment(anyString())).thenThrow(new IllegalStateException("segmenter down"));

        assertThat(normalizer.normalize(THAI)).containsExactly(THAI);
    }

    @Test
    @DisplayName("Slow segmenter falls back to the unsegmented text")
    void testSegmenterTimeout() {
        config.setSegmenterTimeout(Duration.ofMillis(50));
        when(segmenter.segment(anyString())).thenAnswer(invocation -> {
            Thread.sleep(1_000);
            return "สวัสดี ครับ";
        });

        assertThat(normalizer.normalize(THAI)).containsExactly(THAI);
    }

    @Test
    @DisplayName("Blank segmenter output falls back to the unsegmented text")
    void testBlankSegmenterOutput() {
        when(segmenter.segment(THAI)).thenReturn(" ");

        assertThat(normalizer.normalize(THAI)).containsExactly(THAI);
    }

    @Test
    @DisplayName("A worker pool that refuses the segmenter task falls back to unsegmented text")
    void testSegmenterTaskRejected() {
        executor.shutdown();

        assertThat(normalizer.normalize(THAI)).containsExactly(THAI);
        verifyNoInteractions(segmenter);
    }
}
