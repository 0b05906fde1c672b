package com.project.lepidoptera.landmarks.config;

import com.project.lepidoptera.landmarks.cache.LruResultCache;
import com.project.lepidoptera.landmarks.cache.ResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(LandmarkProperties.class)
public class CacheConfig {
    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    public ResultCache resultCache(LandmarkProperties properties) {
        LandmarkProperties.Cache cache = properties.getCache();
        if (!cache.isEnabled()) {
            log.info("Result cache disabled");
            return ResultCache.disabled();
        }
        log.info("Result cache enabled, capacity {}", cache.getCapacity());
        return new LruResultCache(cache.getCapacity());
    }
}
