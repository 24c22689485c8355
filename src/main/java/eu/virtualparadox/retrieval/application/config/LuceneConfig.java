package eu.virtualparadox.retrieval.application.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates and manages the Lucene resources backing the chunk store
 * (Directory, IndexWriter, SearcherManager).
 * <p>Resources are opened against the on-disk index under {@code retrieval.index} and closed on shutdown.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;

    /**
     * Provides the Lucene FS directory bound to the configured index path.
     *
     * @param props application properties
     * @return opened {@link Directory}
     * @throws IOException if the path cannot be created or opened
     */
    @Bean
    public Directory luceneDirectory(final ApplicationConfig props) throws IOException {
        final Path indexPath = props.getIndex();
        Files.createDirectories(indexPath);
        this.directory = FSDirectory.open(indexPath);
        log.info("Opened chunk store index at {}", indexPath);
        return this.directory;
    }

    /**
     * Index writer over the chunk store. Chunk text is stored, never tokenized, so the
     * writer keeps Lucene's default analyzer.
     */
    @Bean
    public IndexWriter indexWriter(final Directory dir) throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig()
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.indexWriter = new IndexWriter(dir, cfg);
        return this.indexWriter;
    }

    /**
     * Provides a {@link SearcherManager} for near-real-time reads.
     *
     * @param writer index writer
     * @return {@link SearcherManager}
     * @throws IOException on failure
     */
    @Bean
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        this.searcherManager = new SearcherManager(writer, null);
        return this.searcherManager;
    }

    @PreDestroy
    public void close() {
        try { if (searcherManager != null) searcherManager.close(); } catch (Exception e) {
            log.error("Unable to close SearcherManager", e);
        }

        try { if (indexWriter != null) indexWriter.close(); } catch (Exception e) {
            log.error("Unable to close IndexWriter", e);
        }

        try { if (directory != null) directory.close(); } catch (Exception e) {
            log.error("Unable to close Directory", e);
        }
    }
}
