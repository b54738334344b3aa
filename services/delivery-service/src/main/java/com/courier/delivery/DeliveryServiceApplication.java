package com.courier.delivery;

import com.courier.delivery.config.DeliveryServiceProperties;
import com.courier.delivery.config.EventStoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Delivery service: tracks deliveries as event-sourced aggregates.
 *
 * <p>Commands arrive over REST, are validated against the state replayed from the event log and,
 * when accepted, appended as new events. See {@code EventStoreConfig} for how the engine is wired.
 */
@SpringBootApplication
@EnableConfigurationProperties({DeliveryServiceProperties.class, EventStoreProperties.class})
public class DeliveryServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(DeliveryServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DeliveryServiceApplication.class, args);
        log.info("Delivery service started");
    }
}
