package com.fedsearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration for the federated search service, bound from {@code fedsearch.*}.
 *
 * Every nested group carries working defaults so the service (and unit tests) can run
 * with an empty configuration.
 */
@Data
@ConfigurationProperties(prefix = "fedsearch")
public class FedSearchProperties {

    private List<ConnectionProperties> connections = new ArrayList<>();
    private Schema schema = new Schema();
    private Cache cache = new Cache();
    private Search search = new Search();
    private Embedding embedding = new Embedding();
    private Documents documents = new Documents();

    @Data
    public static class ConnectionProperties {
        private String id;

        /**
         * Values: postgres, mysql, sqlite, sqlserver (aliases are normalized).
         */
        private String dialect;
        private String jdbcUrl;
        private String username;
        private String password;

        /**
         * SQL Server only: use Windows integrated authentication instead of username/password.
         */
        private boolean integratedAuth = false;
        private int maxPoolSize = 5;
        private int connectionTimeoutMs = 5000;
        private int queryTimeoutMs = 30000;

        /**
         * Cache TTL for results of this connection; falls back to {@code fedsearch.cache.default-ttl}.
         */
        private Duration cacheTtl;
        private int rowLimit = 1000;
    }

    @Data
    public static class Schema {
        private Duration ttl = Duration.ofHours(1);
        private int topK = 3;
        private int sampleRows = 3;
        private double minRelevance = 0.05;
    }

    @Data
    public static class Cache {
        private Duration defaultTtl = Duration.ofHours(1);
        private long maxBytes = 100L * 1024 * 1024;
        private int pageSize = 50;
    }

    @Data
    public static class Search {
        private long globalTimeoutMs = 30000;
        private long sqlTimeoutMs = 25000;
        private long docTimeoutMs = 10000;
        private int topK = 10;
        private int threads = 8;
        private int queueCapacity = 64;
        private List<String> sourcePriority = new ArrayList<>(List.of("sql", "doc"));
        private double sqlWeight = 1.0;
        private double docWeight = 1.0;
    }

    @Data
    public static class Embedding {
        /**
         * Values: hashing | http
         */
        private String provider = "hashing";
        private int dimension = 384;
        private String baseUrl;
        private String model;
        private int timeoutMs = 10000;
    }

    @Data
    public static class Documents {
        /**
         * Values: memory | qdrant
         */
        private String store = "memory";
        private String qdrantUrl = "http://localhost:6333";
        private String collection = "documents";
        private String apiKey;
        private int timeoutMs = 10000;
    }
}
