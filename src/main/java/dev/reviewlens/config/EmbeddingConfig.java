package dev.reviewlens.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model, the vector index and the circuit breaker guarding it.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running in-process.
 * The same bean embeds reviews at indexing time, retrieval queries and cache keys, which keeps
 * similarity scores comparable across all three.
 *
 * <p>The vector index is selected with {@code reviewlens.vector-index.type}:
 * {@code in-memory} (default, rebuilt on every start) or {@code pgvector}.
 *
 * @see dev.reviewlens.search.HybridRetrievalService
 */
@Configuration
public class EmbeddingConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    /** Output dimension of bge-small-en-v1.5. */
    static final int EMBEDDING_DIMENSION = 384;

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
     * In-process vector index, populated at startup by the review indexer.
     *
     * @return an empty in-memory embedding store
     */
    @Bean
    @ConditionalOnProperty(name = "reviewlens.vector-index.type", havingValue = "in-memory",
            matchIfMissing = true)
    public EmbeddingStore<TextSegment> inMemoryEmbeddingStore() {
        log.info("Using in-memory vector index");
        return new InMemoryEmbeddingStore<>();
    }

    /**
     * pgvector-backed vector index. The table is created on first use; metadata is stored as
     * combined JSON so that {@code review_id IN (...)} filters can be pushed down to SQL.
     *
     * @param host     PostgreSQL host
     * @param port     PostgreSQL port
     * @param database database name
     * @param user     database user
     * @param password database password
     * @param table    table holding review embeddings
     * @return a persistent embedding store
     */
    @Bean
    @ConditionalOnProperty(name = "reviewlens.vector-index.type", havingValue = "pgvector")
    public EmbeddingStore<TextSegment> pgVectorEmbeddingStore(
            @Value("${reviewlens.vector-index.pgvector.host}") String host,
            @Value("${reviewlens.vector-index.pgvector.port:5432}") int port,
            @Value("${reviewlens.vector-index.pgvector.database}") String database,
            @Value("${reviewlens.vector-index.pgvector.user}") String user,
            @Value("${reviewlens.vector-index.pgvector.password}") String password,
            @Value("${reviewlens.vector-index.pgvector.table:review_embeddings}") String table) {
        log.info("Using pgvector index {}:{}/{} table {}", host, port, database, table);
        return PgVectorEmbeddingStore.builder()
                .host(host)
                .port(port)
                .database(database)
                .user(user)
                .password(password)
                .table(table)
                .dimension(EMBEDDING_DIMENSION)
                .createTable(true)
                .useIndex(true)
                .indexListSize(100)
                .build();
    }

    /**
     * Circuit breaker around vector index searches. Once open, searches short-circuit and retrieval
     * falls back to lexical ranking until the wait duration elapses.
     *
     * @param failureRateThreshold failure percentage that opens the circuit
     * @param slidingWindowSize    number of recent calls evaluated
     * @param waitInOpenState      time the circuit stays open before probing again
     * @return the named circuit breaker
     */
    @Bean
    public CircuitBreaker vectorIndexCircuitBreaker(
            @Value("${reviewlens.vector-index.circuit-breaker.failure-rate-threshold:50}")
                    float failureRateThreshold,
            @Value("${reviewlens.vector-index.circuit-breaker.sliding-window-size:10}")
                    int slidingWindowSize,
            @Value("${reviewlens.vector-index.circuit-breaker.wait-in-open-state:60s}")
                    Duration waitInOpenState) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(slidingWindowSize)
                .waitDurationInOpenState(waitInOpenState)
                .build();
        CircuitBreaker circuitBreaker = CircuitBreaker.of("vectorIndex", config);
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("Vector index circuit breaker: {}",
                        event.getStateTransition()));
        return circuitBreaker;
    }
}
