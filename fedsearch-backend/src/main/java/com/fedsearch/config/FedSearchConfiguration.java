package com.fedsearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fedsearch.cache.QueryCacheManager;
import com.fedsearch.document.InMemoryVectorStore;
import com.fedsearch.document.QdrantVectorStore;
import com.fedsearch.document.VectorStore;
import com.fedsearch.embedding.EmbeddingService;
import com.fedsearch.embedding.HashingEmbeddingService;
import com.fedsearch.embedding.HttpEmbeddingService;
import com.fedsearch.search.MinMaxScoreFusion;
import com.fedsearch.search.ScoreFusion;
import com.fedsearch.search.SourceType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class FedSearchConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool for the search paths. A full queue rejects new work instead of blocking the
     * request thread.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService searchExecutor(FedSearchProperties properties) {
        FedSearchProperties.Search search = properties.getSearch();
        int threads = Math.max(2, search.getThreads());
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(
                threads,
                threads,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, search.getQueueCapacity())),
                r -> {
                    Thread t = new Thread(r, "fedsearch-search-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(destroyMethod = "close")
    public QueryCacheManager queryCacheManager(ObjectMapper objectMapper, Clock clock, FedSearchProperties properties) {
        return new QueryCacheManager(objectMapper, clock, properties.getCache());
    }

    @Bean
    public EmbeddingService embeddingService(ObjectMapper objectMapper, FedSearchProperties properties) {
        FedSearchProperties.Embedding embedding = properties.getEmbedding();
        String provider = embedding.getProvider() == null ? "hashing" : embedding.getProvider().trim().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "hashing" -> new HashingEmbeddingService(embedding.getDimension());
            case "http" -> new HttpEmbeddingService(objectMapper, embedding.getBaseUrl(), embedding.getModel(),
                    embedding.getDimension(), embedding.getTimeoutMs());
            default -> throw new IllegalStateException("Unsupported fedsearch.embedding.provider: " + embedding.getProvider());
        };
    }

    @Bean
    public VectorStore vectorStore(ObjectMapper objectMapper, FedSearchProperties properties) {
        FedSearchProperties.Documents documents = properties.getDocuments();
        String store = documents.getStore() == null ? "memory" : documents.getStore().trim().toLowerCase(Locale.ROOT);
        return switch (store) {
            case "memory" -> new InMemoryVectorStore();
            case "qdrant" -> new QdrantVectorStore(objectMapper, documents);
            default -> throw new IllegalStateException("Unsupported fedsearch.documents.store: " + documents.getStore());
        };
    }

    @Bean
    public ScoreFusion scoreFusion(FedSearchProperties properties) {
        FedSearchProperties.Search search = properties.getSearch();
        Map<SourceType, Double> weights = new EnumMap<>(SourceType.class);
        weights.put(SourceType.SQL, search.getSqlWeight());
        weights.put(SourceType.DOC, search.getDocWeight());
        List<SourceType> priority = search.getSourcePriority().stream()
                .map(name -> SourceType.valueOf(name.trim().toUpperCase(Locale.ROOT)))
                .toList();
        return new MinMaxScoreFusion(weights, priority);
    }
}
