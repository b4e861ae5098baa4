package com.propertyintel.leads.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LeadPack {

    String label;

    /** Matching properties in the group before truncation */
    int total;

    List<ScoredProperty> topProperties;

    public double topScore() {
        return topProperties.isEmpty() ? 0.0 : topProperties.get(0).getListingScore();
    }
}
