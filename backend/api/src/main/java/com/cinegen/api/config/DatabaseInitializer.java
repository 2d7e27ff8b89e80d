package com.cinegen.api.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.jdbc.datasource.init.ScriptException;

import javax.sql.DataSource;

/**
 * MyBatis 저장소 사용 시 generation_job 스키마 적용
 * CREATE TABLE IF NOT EXISTS 이므로 기동할 때마다 실행해도 된다.
 */
@Slf4j
public class DatabaseInitializer {

    static final String SCHEMA_LOCATION = "db/schema-mysql.sql";

    private final DataSource dataSource;

    public DatabaseInitializer(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void initialize() {
        log.info("[Store] Applying job store schema: {}", SCHEMA_LOCATION);
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        populator.setSqlScriptEncoding("UTF-8");
        try {
            populator.execute(dataSource);
        } catch (ScriptException e) {
            throw new IllegalStateException("Failed to apply job store schema " + SCHEMA_LOCATION, e);
        }
        log.info("[Store] Job store schema ready");
    }
}
