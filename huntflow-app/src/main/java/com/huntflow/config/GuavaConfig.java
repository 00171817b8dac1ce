package com.huntflow.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.huntflow.infrastructure.vector.CorpusRule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 * <p>
 * 检测规则语料的本地只读缓存，写入后按 TTL 过期，审核通过写入语料时主动失效。
 * </p>
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "corpusCache")
    public Cache<String, List<CorpusRule>> corpusCache(
            @Value("${huntflow.corpus.cache-ttl-seconds:300}") long ttlSeconds) {
        return CacheBuilder.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(Math.max(ttlSeconds, 1L), TimeUnit.SECONDS)
                .build();
    }

}
