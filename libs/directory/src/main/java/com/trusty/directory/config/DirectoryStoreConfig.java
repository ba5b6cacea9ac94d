package com.trusty.directory.config;

import com.trusty.directory.DirectoryRepository;
import com.trusty.directory.InMemoryDirectoryRepository;
import com.trusty.directory.jdbc.JdbcDirectoryRepository;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link DirectoryRepository} selected by {@code trusty.directory.store-type}, matched
 * against the bound {@link DirectoryProperties.StoreType} (see {@link StoreTypeCondition}).
 *
 * <p>WHY our own DataSource and Flyway instead of Boot's auto-configuration: the directory owns its
 * schema location and connection settings under {@code trusty.directory}, and the in-memory store
 * must start without any database at all. Services importing this configuration exclude {@code
 * DataSourceAutoConfiguration} and {@code FlywayAutoConfiguration}.
 */
@Configuration
@EnableConfigurationProperties(DirectoryProperties.class)
public class DirectoryStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(DirectoryStoreConfig.class);

    /** Bean name of the directory DataSource. */
    public static final String DIRECTORY_DATA_SOURCE_BEAN = "directoryDataSource";

    @Bean(name = DIRECTORY_DATA_SOURCE_BEAN)
    @Conditional(StoreTypeCondition.Jdbc.class)
    public DataSource directoryDataSource(DirectoryProperties properties) {
        DirectoryProperties.Jdbc jdbc = requireJdbc(properties);
        return DataSourceBuilder.create()
                .url(jdbc.url())
                .username(jdbc.username())
                .password(jdbc.password())
                .build();
    }

    @Bean
    @Conditional(StoreTypeCondition.Jdbc.class)
    public DirectoryRepository jdbcDirectoryRepository(
            DirectoryProperties properties, DataSource directoryDataSource) {
        DirectoryProperties.Jdbc jdbc = requireJdbc(properties);
        if (jdbc.migrateOnStartup()) {
            migrate(directoryDataSource, jdbc.locations());
        }
        log.info("Directory store: PostgreSQL at {}", jdbc.url());
        return new JdbcDirectoryRepository(directoryDataSource);
    }

    @Bean
    @Conditional(StoreTypeCondition.InMemory.class)
    public DirectoryRepository inMemoryDirectoryRepository() {
        log.warn("Directory store: in-memory; data is lost on restart");
        return new InMemoryDirectoryRepository();
    }

    /** Applies pending migrations from {@code locations}. */
    public static void migrate(DataSource dataSource, String locations) {
        var result =
                Flyway.configure()
                        .dataSource(dataSource)
                        .locations(locations)
                        .baselineOnMigrate(true)
                        .cleanDisabled(true)
                        .load()
                        .migrate();
        log.info(
                "Directory schema at version {} ({} migration(s) applied)",
                result.targetSchemaVersion,
                result.migrationsExecuted);
    }

    private static DirectoryProperties.Jdbc requireJdbc(DirectoryProperties properties) {
        if (properties.jdbc() == null) {
            throw new IllegalStateException(
                    "trusty.directory.jdbc must be configured when store-type is jdbc");
        }
        return properties.jdbc();
    }
}
