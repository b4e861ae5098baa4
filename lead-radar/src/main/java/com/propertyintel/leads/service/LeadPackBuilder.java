package com.propertyintel.leads.service;

import com.propertyintel.leads.model.GroupBy;
import com.propertyintel.leads.model.LeadPack;
import com.propertyintel.leads.model.ScoredProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets scored properties by a {@link GroupBy} attribute into ranked, size-capped packs.
 */
@Component
public class LeadPackBuilder {

    static final String UNCLASSIFIED = "unclassified";

    static final Comparator<ScoredProperty> BY_SCORE_DESC =
            Comparator.comparingDouble(ScoredProperty::getListingScore).reversed();

    public List<LeadPack> build(List<ScoredProperty> scored, GroupBy groupBy, int packSize) {
        Map<String, List<ScoredProperty>> buckets = new LinkedHashMap<>();
        for (ScoredProperty item : scored) {
            String value = groupBy.labelOf(item.getProperty());
            String label = value == null || value.isBlank() ? UNCLASSIFIED : value;
            buckets.computeIfAbsent(label, k -> new ArrayList<>()).add(item);
        }

        List<LeadPack> packs = new ArrayList<>(buckets.size());
        buckets.forEach((label, items) -> packs.add(LeadPack.builder()
                .label(label)
                .total(items.size())
                .topProperties(items.stream().sorted(BY_SCORE_DESC).limit(packSize).toList())
                .build()));

        packs.sort(Comparator.comparingDouble(LeadPack::topScore).reversed());
        return packs;
    }
}
