package com.signalledger.watcher.persistence;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/** Row of {@code signal_validation_events}: one per applied transition. */
@Data
@NoArgsConstructor
@Table("signal_validation_events")
public class ValidationEventEntity {

    @Id
    private Long id;

    private Long          signalId;
    private String        fromState;
    private String        toState;
    private String        cause;
    private String        reason;
    private LocalDateTime candleTime;
    private Double        candleOpen;
    private Double        candleHigh;
    private Double        candleLow;
    private Double        candleClose;
    private LocalDateTime recordedAt;
}
