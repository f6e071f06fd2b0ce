package com.o2o.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * O2O Delivery Analytics Engine
 *
 * Serves aggregated delivery-order analytics from one of two engines and keeps
 * them consistent with the raw order facts.
 *
 * Architecture:
 * - Aggregate store: precomputed segments per definition, dimension key and bucket
 * - Columnar snapshot: daily Parquet partitions scanned with DuckDB
 * - Query router: picks the engine from the data tier, with deadlines and fallback
 * - Versioned query cache: results invalidated by data version, single-flight computation
 * - Sync scheduler: nightly and hourly rebuilds, mutation-driven refresh, consistency repair
 *
 * Tiers:
 * - SMALL (< 100k rows), MEDIUM (< 1M): aggregate store
 * - LARGE (< 10M), HUGE: columnar snapshot
 */
@SpringBootApplication
@EnableScheduling
public class O2oAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(O2oAnalyticsApplication.class, args);
    }
}
