package com.transmissionweb.feeder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Transmission feed automation service.
 *
 * - Polls subscribed RSS/Atom feeds on a timer
 * - Submits items whose titles match the feed pattern to the Transmission daemon
 * - Records every submitted item so it is never submitted twice
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FeederApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeederApplication.class, args);
    }
}
