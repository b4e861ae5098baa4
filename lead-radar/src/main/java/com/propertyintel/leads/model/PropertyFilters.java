package com.propertyintel.leads.model;

import com.propertyintel.leads.service.InvalidFilterException;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable query over scored properties. All criteria are optional and AND-combined.
 */
@Value
@Builder(toBuilder = true)
public class PropertyFilters {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    // ── Text ────────────────────────────────────────────────────────────────
    /** Substring match */
    String city;
    /** Prefix match */
    String state;
    /** Prefix match */
    String postalCode;
    /** Free text across address, owner contact and identifiers */
    String search;

    // ── Thresholds ──────────────────────────────────────────────────────────
    Double minEquity;
    Double minScore;
    Double minValueGap;
    Double minMarketValue;
    Double maxMarketValue;
    Double minAssessedValue;
    Double maxAssessedValue;

    OwnerOccupancy ownerOccupancy;

    // ── Radius search ───────────────────────────────────────────────────────
    Double centerLatitude;
    Double centerLongitude;
    Double radiusMiles;

    // ── Paging ──────────────────────────────────────────────────────────────
    @Builder.Default
    int limit = DEFAULT_LIMIT;
    @Builder.Default
    int offset = 0;

    public boolean hasRadius() {
        return radiusMiles != null;
    }

    /**
     * Reject combinations that cannot be evaluated.
     *
     * @throws InvalidFilterException when a radius is given without both center coordinates,
     *                                or the radius is not positive
     */
    public void validate() {
        if (radiusMiles == null) return;
        if (centerLatitude == null || centerLongitude == null) {
            throw new InvalidFilterException(
                    "center_latitude and center_longitude are required when radius_miles is provided");
        }
        if (radiusMiles <= 0) {
            throw new InvalidFilterException("radius_miles must be greater than zero");
        }
    }

    public static int clampLimit(Integer limit) {
        if (limit == null || limit == 0) return DEFAULT_LIMIT;
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    public static int clampOffset(Integer offset) {
        return offset == null ? 0 : Math.max(0, offset);
    }

    /** Trim, mapping blank input to null. */
    public static String clean(String text) {
        if (text == null) return null;
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
