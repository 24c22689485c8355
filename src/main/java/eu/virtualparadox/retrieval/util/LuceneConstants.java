package eu.virtualparadox.retrieval.util;

public class LuceneConstants {
    public static final String FIELD_OWNER_ID = "ownerId";
    public static final String FIELD_DOC_ID = "docId";
    public static final String FIELD_CHUNK_INDEX = "chunkIndex";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_EMBEDDING = "embedding";

    private LuceneConstants() {
        // prevent instantiation
    }
}
