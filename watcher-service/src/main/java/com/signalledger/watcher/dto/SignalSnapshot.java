package com.signalledger.watcher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalledger.common.model.Signal;
import com.signalledger.common.model.ValidationEvent;

import java.util.List;

/** A signal with its audit trail and, when the feed answered, the latest price. */
public record SignalSnapshot(
    @JsonProperty("signal")      Signal signal,
    @JsonProperty("latestPrice") Double latestPrice,
    @JsonProperty("events")      List<ValidationEvent> events
) {}
