package com.chicu.causalimpact.config;

import com.chicu.causalimpact.engine.cache.ImpactCache;
import com.chicu.causalimpact.engine.cache.InMemoryImpactCache;
import com.chicu.causalimpact.engine.cache.NoopImpactCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(CausalImpactProperties.class)
public class CausalImpactConfig {

    @Bean
    public ImpactCache impactCache(CausalImpactProperties props) {
        CausalImpactProperties.Cache c = props.getCache();
        if (!c.isEnabled()) {
            log.info("🧹 ImpactCache выключен");
            return new NoopImpactCache();
        }
        log.info("🧹 ImpactCache в памяти: maxEntries={}", c.getMaxEntries());
        return new InMemoryImpactCache(c.getMaxEntries());
    }
}
