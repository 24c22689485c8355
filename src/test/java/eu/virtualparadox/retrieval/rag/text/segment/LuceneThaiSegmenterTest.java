package eu.virtualparadox.retrieval.rag.text.segment;

import eu.virtualparadox.retrieval.rag.text.ThaiText;
import org.apache.lucene.analysis.th.ThaiTokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class LuceneThaiSegmenterTest {

    private final LuceneThaiSegmenter segmenter = new LuceneThaiSegmenter();

    @Test
    @DisplayName("Thai text is split into space separated words")
    void testSegmentsThai() {
        assumeTrue(ThaiTokenizer.DBBI_AVAILABLE, "JRE has no Thai dictionary");
        final String text = "สวัสดีครับ";

        final String segmented = segmenter.segment(text);

        assertThat(segmented.split(" ")).hasSizeGreaterThanOrEqualTo(2);
        assertThat(ThaiText.stripSpaces(segmented)).isEqualTo(text);
    }

    @Test
    @DisplayName("Blank and null input pass through")
    void testBlankInput() {
        assertThat(segmenter.segment("  ")).isEqualTo("  ");
        assertThat(segmenter.segment(null)).isNull();
    }
}
