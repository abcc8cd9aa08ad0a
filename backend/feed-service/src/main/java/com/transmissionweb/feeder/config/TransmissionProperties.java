package com.transmissionweb.feeder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the Transmission RPC endpoint.
 */
@ConfigurationProperties(prefix = "transmission")
@Data
public class TransmissionProperties {

    /**
     * Full RPC endpoint, e.g. http://host:9091/transmission/rpc
     */
    private String url = "http://localhost:9091/transmission/rpc";

    /**
     * Basic auth user. Blank disables the Authorization header.
     */
    private String username;

    private String password;

    /**
     * Upper bound for a single RPC round trip.
     */
    private Duration timeout = Duration.ofSeconds(10);

    /**
     * Directory queried by the free-space endpoint when no path is given.
     */
    private String downloadDir = "/data/transmission";

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }
}
