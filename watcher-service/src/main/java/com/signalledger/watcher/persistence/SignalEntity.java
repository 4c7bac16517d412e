package com.signalledger.watcher.persistence;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Row of {@code signals}. Timestamps are stored as UTC {@link LocalDateTime};
 * enums as their names. Only {@link R2dbcSignalStore} reads or writes it.
 */
@Data
@NoArgsConstructor
@Table("signals")
public class SignalEntity {

    @Id
    private Long id;

    private String        asset;
    private String        timeframe;
    private String        direction;
    private double        entryPrice;
    private double        tp;
    private double        sl;
    private double        rewardRiskRatio;
    private double        rawConfidence;
    private Double        releaseConfidence;
    private String        state;
    private String        status;
    private String        result;
    private LocalDateTime generatedAt;
    private LocalDateTime expiresAt;
    private LocalDateTime entryHitAt;
    private LocalDateTime closedAt;
    private LocalDateTime acknowledgedAt;
    private boolean       released;
}
