package com.signalledger.common.structure;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One renderable justification behind a {@link StructureState}.
 *
 * <p>{@code strength} is the 0..1 conviction of the underlying event; {@code value}
 * is its signed contribution to the directional score (negative for rejected fakes,
 * the ratio itself for {@link EvidenceType#DOMINANCE}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvidenceItem(
    @JsonProperty("type")        EvidenceType type,
    @JsonProperty("description") String description,
    @JsonProperty("direction")   StructureDirection direction,
    @JsonProperty("priceLevel")  Double priceLevel,
    @JsonProperty("strength")    Double strength,
    @JsonProperty("candleIndex") Integer candleIndex,
    @JsonProperty("value")       Double value
) {
    public static EvidenceItem note(EvidenceType type, String description) {
        return new EvidenceItem(type, description, null, null, null, null, null);
    }
}
