package com.signalledger.watcher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Self-description of the structure / confidence stack for health probes. */
public record StructureHealth(
    @JsonProperty("status")           String status,
    @JsonProperty("engine")           String engine,
    @JsonProperty("version")          String version,
    @JsonProperty("reasoningType")    String reasoningType,
    @JsonProperty("learnedComponent") boolean learnedComponent
) {}
