package eu.virtualparadox.retrieval.rag.text.segment;

/**
 * Inserts word boundaries (single spaces) into Thai text, which is written without them.
 */
public interface ThaiSegmenter {

    /**
     * Segments the given text.
     *
     * @param text raw text, may mix Thai and other scripts
     * @return text with words separated by single spaces; the original text if segmentation is not possible
     */
    String segment(final String text);
}
