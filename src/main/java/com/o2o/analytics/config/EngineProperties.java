package com.o2o.analytics.config;

import com.o2o.analytics.domain.model.BucketGranularity;
import com.o2o.analytics.domain.model.Reducer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine configuration bound from {@code o2o.engine.*}.
 *
 * Example (application.yml):
 * <pre>
 * o2o:
 *   engine:
 *     router:
 *       large-threshold: 1000000
 *     cache:
 *       store: local
 *       ttl: 1h
 *     consistency:
 *       tolerance: 0.05
 *     definitions:
 *       - id: store_daily_summary
 *         group-by: [store_id]
 *         measures:
 *           - name: order_count
 *             source: order_id
 *             reducer: COUNT_DISTINCT
 * </pre>
 *
 * Every value has a default so the engine starts with an empty section.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "o2o.engine")
public class EngineProperties {

    @Valid
    private RouterProperties router = new RouterProperties();

    @Valid
    private CacheProperties cache = new CacheProperties();

    @Valid
    private ConsistencyProperties consistency = new ConsistencyProperties();

    @Valid
    private SyncProperties sync = new SyncProperties();

    private ColumnarProperties columnar = new ColumnarProperties();

    @Valid
    private SlowQueryProperties slowQuery = new SlowQueryProperties();

    @Valid
    private WarmupProperties warmup = new WarmupProperties();

    @Valid
    private List<DefinitionProperties> definitions = new ArrayList<>();

    @Data
    public static class RouterProperties {

        /**
         * Record count at which the MEDIUM tier starts.
         */
        @Min(1)
        private long mediumThreshold = 100_000L;

        /**
         * Record count at which queries move to the columnar snapshot.
         */
        @Min(1)
        private long largeThreshold = 1_000_000L;

        @Min(1)
        private long hugeThreshold = 10_000_000L;

        /**
         * Deadline for a single engine call.
         */
        private Duration queryTimeout = Duration.ofSeconds(10);

        /**
         * How long an engine that timed out or failed is skipped.
         */
        private Duration degradedCooldown = Duration.ofSeconds(30);
    }

    @Data
    public static class CacheProperties {

        /**
         * local (Caffeine) or redis.
         */
        @NotBlank
        private String store = "local";

        private Duration ttl = Duration.ofHours(1);

        /**
         * Maximum random offset applied to ttl in both directions.
         */
        private Duration jitter = Duration.ofMinutes(5);

        /**
         * TTL for results that came back empty.
         */
        private Duration emptyTtl = Duration.ofSeconds(60);

        @Min(1)
        private long maxEntries = 10_000L;

        /**
         * How long a caller waits for another caller computing the same key.
         */
        private Duration computeTimeout = Duration.ofSeconds(15);

        @NotBlank
        private String keyPrefix = "o2o:query";
    }

    @Data
    public static class ConsistencyProperties {

        /**
         * Relative delta above which a segment counts as mismatched.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double tolerance = 0.05;

        @Min(1)
        private int lookbackDays = 7;

        private Duration interval = Duration.ofHours(1);
    }

    @Data
    public static class SyncProperties {

        @Min(1)
        private int backfillDays = 30;

        @Min(1)
        private int workerThreads = 2;

        private String nightlyCron = "0 0 2 * * *";

        private String hourlyCron = "0 0 * * * *";

        private Duration recordCountInterval = Duration.ofSeconds(60);

        /**
         * Number of finished jobs kept for status reporting.
         */
        private int jobHistorySize = 100;
    }

    @Data
    public static class ColumnarProperties {

        private boolean enabled = true;

        private String dataDir = "data/columnar";
    }

    @Data
    public static class SlowQueryProperties {

        /**
         * Latency at which a query is recorded as slow.
         */
        private Duration threshold = Duration.ofMillis(100);

        /**
         * Latency at which a slow query is also logged as a warning.
         */
        private Duration warnThreshold = Duration.ofMillis(500);

        /**
         * Number of recent slow queries kept for status reporting.
         */
        @Min(1)
        private int maxRecords = 100;
    }

    @Data
    public static class WarmupProperties {

        private boolean enabled = true;

        /**
         * Lengths in days of the windows ending today that are warmed per definition.
         */
        private List<@Min(1) Integer> windowDays = new ArrayList<>(List.of(1, 7));
    }

    @Data
    public static class DefinitionProperties {

        @NotBlank
        private String id;

        private String description;

        private List<String> groupBy = new ArrayList<>();

        private BucketGranularity bucket = BucketGranularity.DAY;

        private String filter;

        private String primaryMeasure;

        @Valid
        private List<MeasureProperties> measures = new ArrayList<>();

        @Valid
        private List<DerivedProperties> derived = new ArrayList<>();
    }

    @Data
    public static class MeasureProperties {

        @NotBlank
        private String name;

        @NotBlank
        private String source;

        private Reducer reducer = Reducer.SUM;

        private boolean orderLevel;
    }

    @Data
    public static class DerivedProperties {

        @NotBlank
        private String name;

        @NotBlank
        private String formula;
    }
}
