package com.shardql.config;

import com.shardql.model.EmissionMode;
import com.shardql.model.GroupBy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code shardql.*} namespace.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "shardql")
public class ShardqlProperties {

    /** Dataset ids to aggregate over, in presentation order. */
    @NotEmpty
    private List<@NotBlank String> datasets = new ArrayList<>();

    /** Stripped from dataset ids when they are used as response keys. */
    private String datasetKeyPrefix;
    private String datasetKeySuffix;

    /**
     * Threads in the shared fetch pool. Per-endpoint concurrency is bounded by this. Must not
     * exceed the warehouse connection pool, or workers queue on connections and time out.
     */
    @Min(1)
    private int workerPoolSize = 10;

    /** Warehouse-side query timeout, 0 to wait indefinitely. */
    @Min(0)
    private int queryTimeoutSeconds = 0;

    @Valid
    private Discovery discovery = new Discovery();

    @Valid
    private Endpoints endpoints = new Endpoints();

    @Valid
    private Cors cors = new Cors();

    @Valid
    private CacheSettings cache = new CacheSettings();

    @Valid
    private Warehouse warehouse = new Warehouse();

    @AssertTrue(message = "worker-pool-size must not exceed warehouse.maximum-pool-size")
    public boolean isWorkerPoolWithinConnectionPool() {
        return warehouse == null || workerPoolSize <= warehouse.getMaximumPoolSize();
    }

    @Data
    public static class Discovery {
        @Min(1)
        private int concurrency = 2;
    }

    @Data
    public static class Endpoints {
        @Valid
        private EndpointSettings allTables = new EndpointSettings(10);

        @Valid
        private EndpointSettings singleTable = new EndpointSettings(4);
    }

    @Data
    public static class EndpointSettings {
        @Min(1)
        private int rowLimit = 10_000;

        @Min(1)
        private int concurrency;

        private GroupBy groupBy = GroupBy.BY_DATASET;

        private EmissionMode emission = EmissionMode.BUFFERED;

        private boolean useQueryCache = false;

        public EndpointSettings() {
            this(4);
        }

        public EndpointSettings(int concurrency) {
            this.concurrency = concurrency;
        }
    }

    @Data
    public static class Cors {
        /** Origins allowed to read responses from a browser; {@code *} for any. */
        private List<@NotBlank String> allowedOrigins = new ArrayList<>(List.of("*"));
    }

    @Data
    public static class CacheSettings {
        /** Upper bound on rows held across all cached results. */
        @Min(0)
        private long maximumRows = 200_000;

        @Min(1)
        private long expireAfterWriteSeconds = 300;
    }

    @Data
    public static class Warehouse {
        private String jdbcUrl;
        private String username;
        private String password;

        /**
         * Optional project qualifier for warehouses with dataset-scoped metadata (BigQuery).
         * When set, tables are listed from {@code <catalog>.<dataset>.INFORMATION_SCHEMA.TABLES}.
         */
        private String catalog;

        @Pattern(regexp = "[\"`]", message = "must be \" or `")
        private String identifierQuote = "\"";

        @Min(1)
        private int maximumPoolSize = 10;

        @Min(250)
        private long connectionTimeoutMs = 5000;

        private boolean readOnly = true;
    }
}
