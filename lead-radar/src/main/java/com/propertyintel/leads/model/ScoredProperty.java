package com.propertyintel.leads.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Data;

/**
 * A property with its listing score. Serialises flat: the property's own fields
 * sit next to listing_score and score_breakdown.
 */
@Data
public class ScoredProperty {

    @JsonUnwrapped
    private final Property property;

    /** 0 to 100, two decimals */
    private final double listingScore;

    private final ScoreBreakdown scoreBreakdown;

    /** Set by a radius search, cleared otherwise */
    private Double distanceFromSearchCenterMiles;
}
