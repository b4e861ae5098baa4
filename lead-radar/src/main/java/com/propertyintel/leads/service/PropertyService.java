package com.propertyintel.leads.service;

import com.propertyintel.leads.model.CacheStatus;
import com.propertyintel.leads.model.GroupBy;
import com.propertyintel.leads.model.LeadPack;
import com.propertyintel.leads.model.LeadPackResponse;
import com.propertyintel.leads.model.Property;
import com.propertyintel.leads.model.PropertyFilters;
import com.propertyintel.leads.model.PropertyListResponse;
import com.propertyintel.leads.model.ScoredProperty;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the per-request pipeline over the cached raw snapshot:
 * normalise, score the whole batch, filter, then sort by listing score.
 *
 * Nothing computed here is stored; every call starts again from the raw records.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PropertyService {

    private final PropertyCache cache;
    private final PropertyNormalizer normalizer;
    private final ListingScorer scorer;
    private final PropertyFilterEngine filterEngine;
    private final LeadPackBuilder packBuilder;
    private final Clock clock;

    public PropertyListResponse listProperties(PropertyFilters filters) {
        List<ScoredProperty> ranked = rank(filters);

        int total = ranked.size();
        int from = Math.min(filters.getOffset(), total);
        int to = Math.min(from + filters.getLimit(), total);
        return new PropertyListResponse(List.copyOf(ranked.subList(from, to)), total,
                filters.getLimit(), filters.getOffset());
    }

    /** Every matching property, ranked, without pagination. */
    public List<ScoredProperty> exportProperties(PropertyFilters filters) {
        return rank(filters);
    }

    /**
     * @throws InvalidFilterException for an unknown group-by key or invalid filters,
     *                                before the cache is consulted
     */
    public LeadPackResponse generateLeadPacks(PropertyFilters filters, String groupBy, int packSize) {
        GroupBy key = GroupBy.fromParam(groupBy);
        if (key == null) {
            throw new InvalidFilterException("group_by must be one of postal_code, zip, zip_code, city, state");
        }
        List<LeadPack> packs = packBuilder.build(rank(filters), key, Math.max(1, packSize));
        log.info("Built {} lead packs grouped by {}", packs.size(), key);
        return new LeadPackResponse(clock.instant(), packs);
    }

    public void refreshCache() {
        log.info("Forced property cache refresh requested");
        cache.refresh();
    }

    public CacheStatus cacheStatus() {
        return cache.status();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<ScoredProperty> rank(PropertyFilters filters) {
        filters.validate();

        List<Map<String, Object>> raw = cache.get();
        List<Property> normalized = new ArrayList<>(raw.size());
        for (Map<String, Object> record : raw) {
            if (record == null) {
                log.warn("Skipping null raw property record");
                continue;
            }
            normalized.add(normalizer.normalize(record));
        }

        List<ScoredProperty> ranked = new ArrayList<>(filterEngine.apply(scorer.score(normalized), filters));
        ranked.sort(LeadPackBuilder.BY_SCORE_DESC);
        logScoringSnapshot(ranked);
        return ranked;
    }

    private void logScoringSnapshot(List<ScoredProperty> ranked) {
        if (!log.isDebugEnabled()) return;
        ranked.stream().limit(5).forEach(p -> log.debug("Score breakdown for {}: score={} breakdown={}",
                p.getProperty().getPropertyId(), p.getListingScore(), p.getScoreBreakdown()));
    }
}
