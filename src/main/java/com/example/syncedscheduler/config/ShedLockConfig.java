package com.example.syncedscheduler.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * ShedLock configuration for the per-job distributed lock.
 * <p>
 * Every instance sharing the database sees the same lock records, so a job lock
 * taken by one instance excludes all others until it is released.
 * Lock times are taken from the database clock to keep instances with skewed
 * clocks consistent.
 */
@Configuration
public class ShedLockConfig {

    @Bean
    public LockProvider lockProvider(DataSource dataSource, SyncedSchedulerProperties properties) {
        return new JdbcTemplateLockProvider(
                JdbcTemplateLockProvider.Configuration.builder()
                        .withJdbcTemplate(new JdbcTemplate(dataSource))
                        .withTableName(properties.getLockTableName())
                        .usingDbTime()
                        .build()
        );
    }
}
