package com.transmissionweb.feeder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "feeder")
@Data
public class FeederProperties {

    /**
     * Interval applied to feeds created without a positive check interval.
     */
    private Duration defaultCheckInterval = Duration.ofMinutes(15);

    private Poll poll = new Poll();

    private Fetch fetch = new Fetch();

    private Downloads downloads = new Downloads();

    @Data
    public static class Poll {
        /** Turns the background poll loop on or off */
        private boolean enabled = true;

        /** Timer period of the poll loop */
        private Duration interval = Duration.ofMinutes(15);

        /** How long shutdown waits for an in-flight cycle */
        private Duration shutdownTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Fetch {
        private Duration timeout = Duration.ofSeconds(30);

        private Duration connectTimeout = Duration.ofSeconds(10);

        private String userAgent = "TransmissionWeb-Feeder/1.0";
    }

    @Data
    public static class Downloads {
        private int defaultLimit = 50;

        private int maxLimit = 500;
    }
}
