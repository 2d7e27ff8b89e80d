package com.cinegen.api.config;

import com.cinegen.api.mapper.GenerationJobMapper;
import com.cinegen.api.store.InMemoryJobStore;
import com.cinegen.api.store.JobStore;
import com.cinegen.api.store.MybatisJobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * 작업 저장소 선택 (cinegen.store.type)
 * - memory (기본): 프로세스 내 ConcurrentHashMap
 * - mybatis: MySQL generation_job 테이블 (기동 시 db/schema-mysql.sql 적용)
 */
@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    public JobStore jobStore(@Value("${cinegen.store.type:memory}") String type,
                             ObjectProvider<GenerationJobMapper> mapperProvider,
                             ObjectProvider<DataSource> dataSourceProvider) {
        if ("mybatis".equalsIgnoreCase(type)) {
            GenerationJobMapper mapper = mapperProvider.getIfAvailable();
            DataSource dataSource = dataSourceProvider.getIfAvailable();
            if (mapper == null || dataSource == null) {
                throw new IllegalStateException("cinegen.store.type=mybatis but no GenerationJobMapper/DataSource is configured");
            }
            // 첫 insert 전에 테이블 보장
            new DatabaseInitializer(dataSource).initialize();
            log.info("[Store] Using MyBatis job store");
            return new MybatisJobStore(mapper);
        }
        if (!"memory".equalsIgnoreCase(type)) {
            throw new IllegalStateException("Unknown cinegen.store.type: " + type);
        }
        log.info("[Store] Using in-memory job store");
        return new InMemoryJobStore();
    }
}
