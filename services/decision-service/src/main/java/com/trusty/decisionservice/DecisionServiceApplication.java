package com.trusty.decisionservice;

import com.trusty.decisionservice.config.DecisionServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Trusty decision service.
 *
 * <p>Answers {@code POST /v1/isallowed} and exposes the directory admin API for tenants, users and
 * roles. The directory store is chosen by {@code trusty.directory.store-type}; its DataSource and
 * Flyway schema are built by {@link com.trusty.directory.config.DirectoryStoreConfig}, so Boot's
 * own DataSource and Flyway auto-configuration are excluded.
 *
 * <p>Binds to {@code TRUSTY_ADDR}:{@code TRUSTY_PORT} (default {@code 0.0.0.0:3030}).
 */
@SpringBootApplication(
        exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@EnableConfigurationProperties(DecisionServiceProperties.class)
public class DecisionServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(DecisionServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DecisionServiceApplication.class, args);
        log.info("Trusty decision service started");
    }
}
