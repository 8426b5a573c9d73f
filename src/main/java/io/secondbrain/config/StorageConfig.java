package io.secondbrain.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Storage configuration. Provides the SQLite DataSource shared by the memory store, the document store
 * and JobRunr; the jobrunr-spring-boot-3-starter auto-configures its StorageProvider from it.
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public DataSource dataSource(SecondBrainProperties properties) {
        Path dbPath = Path.of(properties.storage().path()).toAbsolutePath();
        try {
            if (dbPath.getParent() != null) {
                Files.createDirectories(dbPath.getParent());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create storage directory for " + dbPath, e);
        }
        DataSource ds = sqliteDataSource(dbPath.toString(), properties.storage().busyTimeoutMs());
        log.info("SQLite DataSource configured: {}", dbPath);
        return ds;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Builds a WAL-mode SQLite DataSource whose write transactions take the database lock up front,
     * so concurrent writers wait on the busy timeout instead of failing on lock upgrade.
     */
    public static SQLiteDataSource sqliteDataSource(String dbPath, int busyTimeoutMs) {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(busyTimeoutMs);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        SQLiteDataSource ds = new SQLiteDataSource(config);
        ds.setUrl("jdbc:sqlite:" + dbPath);
        return ds;
    }
}
