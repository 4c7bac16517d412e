package com.signalledger.common.structure;

import java.util.Locale;

/**
 * Turns a {@link StructureEvent} into weighted {@link EvidenceItem}s.
 *
 * <pre>
 *   effective = base(type) × strength × quality
 *   base      : BOS 0.6, CHoCH 0.5, rejected fake −0.4
 *   strength  : 0.5 + 0.3 × body + 0.2 if close accepted        (capped at 1)
 *   quality   : 0.7 ± 0.2 for strong (&gt;0.7) / weak (&lt;0.3) body
 *               + 0.1 if close accepted                           (clamped 0..1)
 * </pre>
 * Rejected fakes carry a fixed strength of 0.8.
 */
public final class EvidenceScorer {

    static final double BOS_BASE   = 0.6;
    static final double CHOCH_BASE = 0.5;
    static final double FAKE_BASE  = -0.4;
    static final double FAKE_STRENGTH = 0.8;

    public EvidenceItem score(StructureEvent event, boolean fake) {
        double quality = quality(event);
        if (fake) {
            double effective = FAKE_BASE * FAKE_STRENGTH * quality;
            String description = String.format(Locale.ROOT,
                "Fake %s breakout rejected at %.5f", event.direction().label().toLowerCase(Locale.ROOT),
                event.brokenLevel());
            return new EvidenceItem(EvidenceType.FAKEOUT_REJECTED, description, event.direction(),
                event.brokenLevel(), FAKE_STRENGTH, event.candleIndex(), round(effective));
        }

        double strength  = strength(event);
        boolean bos      = event.type() == StructureEvent.Type.BOS;
        double effective = (bos ? BOS_BASE : CHOCH_BASE) * strength * quality;
        return new EvidenceItem(bos ? EvidenceType.BOS : EvidenceType.CHOCH, describe(event),
            event.direction(), event.brokenLevel(), round(strength), event.candleIndex(), round(effective));
    }

    static double strength(StructureEvent event) {
        double s = 0.5 + event.bodyStrength() * 0.3;
        if (event.closeAcceptance()) s += 0.2;
        return Math.min(1.0, s);
    }

    static double quality(StructureEvent event) {
        double q = 0.7;
        if (event.bodyStrength() > 0.7)      q += 0.2;
        else if (event.bodyStrength() < 0.3) q -= 0.2;
        if (event.closeAcceptance())         q += 0.1;
        return Math.max(0.0, Math.min(1.0, q));
    }

    private static String describe(StructureEvent event) {
        String kind = event.type() == StructureEvent.Type.BOS ? "BOS confirmed" : "CHoCH detected";
        int bodyPct = (int) Math.round(event.bodyStrength() * 100);
        String detail = event.closeAcceptance()
            ? "body " + bodyPct + "%, close accepted"
            : "wick break, body " + bodyPct + "%";
        return String.format(Locale.ROOT, "%s %s (%s) at %.5f",
            event.direction().label(), kind, detail, event.brokenLevel());
    }

    static double round(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
