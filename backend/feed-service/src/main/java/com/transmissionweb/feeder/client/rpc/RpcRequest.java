package com.transmissionweb.feeder.client.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Request envelope: {"method": ..., "arguments": {...}}. Methods without arguments omit the field.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RpcRequest(String method, Object arguments) {
}
