package com.dating.discovery.config;

import com.dating.discovery.dto.CandidatePage;
import com.dating.discovery.dto.CandidateQuery;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    /**
     * Coarse candidate pool pages keyed by the pushed-down query, cursor included. Entries live for
     * seconds only; exclusions are re-applied on every read.
     */
    @Bean(name = "candidatePoolCache")
    public Cache<CandidateQuery, CandidatePage> candidatePoolCache(DiscoveryProperties properties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(properties.getCandidates().getPoolCacheTtl())
                .maximumSize(properties.getCandidates().getPoolCacheMaxSize())
                .recordStats()
                .build();
    }
}
