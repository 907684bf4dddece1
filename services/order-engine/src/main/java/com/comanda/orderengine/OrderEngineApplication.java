package com.comanda.orderengine;

import com.comanda.orderengine.config.OrderEngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** Order engine entry point. All wiring lives in {@code OrderEngineConfiguration}. */
@SpringBootApplication
@EnableConfigurationProperties(OrderEngineProperties.class)
public class OrderEngineApplication {

    private static final Logger log = LoggerFactory.getLogger(OrderEngineApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(OrderEngineApplication.class, args);
        log.info("Comanda order engine started");
    }
}
