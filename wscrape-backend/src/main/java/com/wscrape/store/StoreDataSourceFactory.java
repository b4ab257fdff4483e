package com.wscrape.store;

import com.wscrape.config.ConfigurationException;
import com.wscrape.config.Login;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the store handle: a HikariCP data source holding a single connection.
 *
 * The pool is created eagerly and fails on the first connection attempt, so an unreachable store is
 * reported while the scraper is being built rather than on the first capture.
 */
@Slf4j
public class StoreDataSourceFactory {

    /**
     * Open the store.
     *
     * @param jdbcUrl JDBC URL
     * @param login store credentials
     * @return started data source; the caller owns it and must close it
     * @throws ConfigurationException if the store cannot be reached
     */
    public HikariDataSource open(String jdbcUrl, Login login) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new ConfigurationException("Store JDBC URL is required");
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(login.getUser());
        config.setPassword(login.getPass());
        config.setPoolName("wscrape-store");
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(1);
        config.setInitializationFailTimeout(1);
        config.setExceptionOverrideClassName(StoreSqlExceptionOverride.class.getName());

        try {
            HikariDataSource dataSource = new HikariDataSource(config);
            log.info("Connected to store: url={}, user={}", jdbcUrl, login.getUser());
            return dataSource;
        } catch (HikariPool.PoolInitializationException e) {
            throw new ConfigurationException("Failed to connect to store " + jdbcUrl + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // bad URL, missing driver
            throw new ConfigurationException("Failed to initialize store " + jdbcUrl + ": " + e.getMessage(), e);
        }
    }
}
