package com.wscrape;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WScrapeApplication {

    public static void main(String[] args) {
        SpringApplication.run(WScrapeApplication.class, args);
    }
}
