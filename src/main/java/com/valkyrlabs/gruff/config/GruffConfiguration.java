package com.valkyrlabs.gruff.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.google.common.base.Ticker;
import com.valkyrlabs.gruff.cache.CacheStore;
import com.valkyrlabs.gruff.cache.GuavaCacheStore;

/**
 * Infrastructure beans the services depend on. A host application can replace the
 * cache store (e.g. with a shared key/value service) or the clock by defining its own.
 */
@Configuration
@EnableConfigurationProperties(GruffProperties.class)
public class GruffConfiguration {

    protected static final Logger logger = LoggerFactory.getLogger(GruffConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock gruffClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(CacheStore.class)
    public CacheStore gruffCacheStore(GruffProperties properties) {
        logger.info("Using in-process cache store (maximumSize={})", properties.getCache().getMaximumSize());
        return new GuavaCacheStore(properties.getCache().getMaximumSize(), Ticker.systemTicker());
    }
}
