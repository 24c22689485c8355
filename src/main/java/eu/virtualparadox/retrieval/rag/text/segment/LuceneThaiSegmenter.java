package eu.virtualparadox.retrieval.rag.text.segment;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.th.ThaiTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.util.StringJoiner;

/**
 * Dictionary-based segmenter on top of Lucene's {@link ThaiTokenizer}, which in turn uses the
 * JDK's Thai {@link java.text.BreakIterator}.
 * <p>Punctuation is dropped; Latin words and digits pass through as their own words.</p>
 */
@Component
@Slf4j
public class LuceneThaiSegmenter implements ThaiSegmenter {

    @PostConstruct
    public void checkDictionary() {
        if (!ThaiTokenizer.DBBI_AVAILABLE) {
            log.warn("JRE has no Thai break iterator dictionary, Thai queries will not be segmented");
        }
    }

    @Override
    public String segment(final String text) {
        if (text == null || text.isBlank() || !ThaiTokenizer.DBBI_AVAILABLE) {
            return text;
        }

        try (ThaiTokenizer tokenizer = new ThaiTokenizer()) {
            final CharTermAttribute term = tokenizer.addAttribute(CharTermAttribute.class);
            tokenizer.setReader(new StringReader(text));
            tokenizer.reset();

            final StringJoiner words = new StringJoiner(" ");
            while (tokenizer.incrementToken()) {
                words.add(term.toString());
            }
            tokenizer.end();

            final String segmented = words.toString();
            return segmented.isEmpty() ? text : segmented;
        } catch (IOException e) {
            log.warn("Thai segmentation failed, keeping original text", e);
            return text;
        }
    }
}
