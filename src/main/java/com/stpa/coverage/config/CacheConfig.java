package com.stpa.coverage.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.stpa.coverage.model.RankingResult;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class CacheConfig {

    /**
     * Ranked results keyed by snapshot fingerprint. Identical snapshots never re-run the pipeline.
     */
    @Bean
    public Cache<String, RankingResult> rankingCache(AnalysisConfig analysisConfig) {
        return Caffeine.newBuilder()
                .recordStats()
                .maximumSize(analysisConfig.getCache().getMaxEntries())
                .expireAfterWrite(analysisConfig.getCache().getExpireAfterWriteMinutes(), TimeUnit.MINUTES)
                .build();
    }
}
