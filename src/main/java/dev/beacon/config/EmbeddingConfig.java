package dev.beacon.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore.SearchMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Configures the query embedding model and the knowledge-base store.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) in-process. The store
 * is the pgvector table written by the ingestion pipeline, searched in {@link SearchMode#HYBRID}
 * mode: lexical and semantic rankings fused with Reciprocal Rank Fusion. Beacon only reads from
 * it, so table creation and indexing are left to ingestion.
 *
 * @see dev.beacon.search.EmbeddingStorePassageRetriever
 */
@Configuration
public class EmbeddingConfig {

    /**
     * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
     *
     * @return a ready-to-use embedding model requiring no external API
     */
    @Bean
    public EmbeddingModel embeddingModel() {
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }

    /**
     * Read-only hybrid-search view of the pgvector knowledge-base table.
     *
     * <p>The {@code textSearchConfig} must match the full-text index the ingestion pipeline builds.
     *
     * @param dataSource       the application's HikariCP data source (no duplicate pool)
     * @param table            the knowledge-base table name
     * @param textSearchConfig the PostgreSQL text search configuration for the lexical side
     * @param rrfK             the RRF fusion constant
     * @return a hybrid-search-capable embedding store backed by pgvector
     */
    @Bean
    public EmbeddingStore<TextSegment> embeddingStore(
            DataSource dataSource,
            @Value("${beacon.store.table:knowledge_chunks}") String table,
            @Value("${beacon.store.text-search-config:english}") String textSearchConfig,
            @Value("${beacon.store.rrf-k:60}") int rrfK) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table(table)
                .dimension(384)
                .createTable(false)
                .useIndex(false)
                .searchMode(SearchMode.HYBRID)
                .textSearchConfig(textSearchConfig)
                .rrfK(rrfK)
                .build();
    }
}
