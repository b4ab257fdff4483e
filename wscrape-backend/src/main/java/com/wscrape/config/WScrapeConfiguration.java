package com.wscrape.config;

import com.wscrape.capture.CaptureObserver;
import com.wscrape.capture.WScrape;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Builds the application's single {@link WScrape} from {@code wscrape.*} properties.
 */
@Slf4j
@Configuration
public class WScrapeConfiguration {

    @Bean
    public WScrapeProperties wScrapeProperties(
            @Value("${wscrape.sql-url}") String sqlUrl,
            @Value("${wscrape.ssh-host}") String sshHost,
            @Value("${wscrape.capture-interval-ms:60000}") long captureIntervalMs,
            @Value("${wscrape.sql-login-file:sql_login.json}") String sqlLoginFile,
            @Value("${wscrape.ssh-login-file:ssh_login.json}") String sshLoginFile,
            @Value("${wscrape.ssh-connect-timeout-ms:10000}") int sshConnectTimeoutMs,
            @Value("${wscrape.command-timeout-ms:60000}") long commandTimeoutMs,
            @Value("${wscrape.ssh-server-alive-interval-ms:15000}") int sshServerAliveIntervalMs,
            @Value("${wscrape.ssh-server-alive-count-max:3}") int sshServerAliveCountMax
    ) {
        return WScrapeProperties.builder()
                .sqlUrl(sqlUrl)
                .sshHost(sshHost)
                .captureIntervalMs(captureIntervalMs)
                .sqlLoginFile(Path.of(sqlLoginFile))
                .sshLoginFile(Path.of(sshLoginFile))
                .sshConnectTimeoutMs(sshConnectTimeoutMs)
                .commandTimeoutMs(commandTimeoutMs)
                .sshServerAliveIntervalMs(sshServerAliveIntervalMs)
                .sshServerAliveCountMax(sshServerAliveCountMax)
                .build();
    }

    @Bean(destroyMethod = "dispose")
    public WScrape wScrape(WScrapeProperties properties, ObjectProvider<CaptureObserver> observer) {
        return new WScrape(properties, observer.getIfAvailable());
    }

    @Bean
    public ApplicationRunner wScrapeAutoStart(WScrape wScrape, @Value("${wscrape.auto-start:false}") boolean autoStart) {
        return args -> {
            if (autoStart) {
                wScrape.start();
            } else {
                log.info("Auto start disabled; use POST /v1/scrape/start to begin capturing from {}", wScrape.getSshHost());
            }
        };
    }
}
