package com.propertyintel.leads.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * Canonical parcel record produced from a raw provider record.
 *
 * Notes:
 *  - propertyId is always present, resolved through a fallback chain
 *  - valueGap and ownerOccupancy are derived, never read from the provider
 *  - built per request and never persisted
 */
@Data
@Builder
public class Property {

    // ── Identity ────────────────────────────────────────────────────────────
    private String propertyId;
    private String parcelId;

    // ── Location ────────────────────────────────────────────────────────────
    private String address;
    private String city;
    private String state;
    private String postalCode;
    private String neighborhood;
    private Double latitude;
    private Double longitude;

    // ── Valuation ───────────────────────────────────────────────────────────
    private Double totalAssessedValue;
    private Double totalMarketValue;

    /** Provider's automated valuation; preferred over totalMarketValue for the value gap */
    private Double modelValue;

    private Double equityCurrentEstBal;
    private Double equityAvailable;

    /** max(market - assessed, 0), null when either side is missing */
    private Double valueGap;

    // ── Ownership ───────────────────────────────────────────────────────────
    private LocalDate transferDate;

    @Builder.Default
    private OwnerContact owner = OwnerContact.builder().build();

    /** Null when any compared address component is empty */
    private OwnerOccupancy ownerOccupancy;

    /** Market value as used by filters and exports: total market value, else the model value. */
    public Double marketValueOrModel() {
        return totalMarketValue != null ? totalMarketValue : modelValue;
    }
}
