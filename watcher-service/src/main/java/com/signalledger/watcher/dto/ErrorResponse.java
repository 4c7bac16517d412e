package com.signalledger.watcher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(
    @JsonProperty("error")     String error,
    @JsonProperty("component") String component,
    @JsonProperty("message")   String message
) {}
