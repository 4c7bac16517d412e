package com.signalledger.watcher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalledger.common.model.SignalState;
import com.signalledger.common.outcome.Outcome;

import java.util.List;

/**
 * Replay of provider candles over every entered signal of one asset.
 *
 * @param compared signals whose recorded outcome could be compared with the replay
 * @param agreed   comparisons where recorded and replayed outcome match
 * @param winRate  TP share among replayed TP/SL outcomes, 0 when there are none
 * @param totalR   sum of replayed R-multiples
 */
public record BackfillReport(
    @JsonProperty("asset")    String asset,
    @JsonProperty("replayed") int replayed,
    @JsonProperty("applied")  int applied,
    @JsonProperty("compared") int compared,
    @JsonProperty("agreed")   int agreed,
    @JsonProperty("winRate")  double winRate,
    @JsonProperty("totalR")   double totalR,
    @JsonProperty("entries")  List<Entry> entries
) {

    public record Entry(
        @JsonProperty("signalId") long signalId,
        @JsonProperty("recorded") SignalState recorded,
        @JsonProperty("replayed") Outcome replayed,
        @JsonProperty("agrees")   Boolean agrees,
        @JsonProperty("rMultiple") double rMultiple,
        @JsonProperty("applied")  boolean applied
    ) {}

    public static BackfillReport of(String asset, List<Entry> entries) {
        int applied = 0, compared = 0, agreed = 0, wins = 0, losses = 0;
        double totalR = 0.0;
        for (Entry e : entries) {
            if (e.applied()) applied++;
            if (e.agrees() != null) {
                compared++;
                if (e.agrees()) agreed++;
            }
            if (e.replayed() == Outcome.HIT_TP) wins++;
            if (e.replayed() == Outcome.HIT_SL) losses++;
            totalR += e.rMultiple();
        }
        double winRate = wins + losses == 0 ? 0.0 : round((double) wins / (wins + losses));
        return new BackfillReport(asset, entries.size(), applied, compared, agreed, winRate, round(totalR),
                                  List.copyOf(entries));
    }

    private static double round(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
