package com.transmissionweb.feeder.client.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PortTestResult(@JsonProperty("port-is-open") boolean portIsOpen) {
}
