package com.propertyintel.leads.service;

import com.propertyintel.leads.model.OwnerContact;
import com.propertyintel.leads.model.Property;
import com.propertyintel.leads.model.PropertyFilters;
import com.propertyintel.leads.model.ScoredProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Applies {@link PropertyFilters} to scored properties, preserving input order.
 *
 * Side effect: a radius search writes distanceFromSearchCenterMiles on every
 * property it measures; without a radius the field is cleared on all inputs.
 */
@Component
public class PropertyFilterEngine {

    public List<ScoredProperty> apply(List<ScoredProperty> properties, PropertyFilters filters) {
        if (!filters.hasRadius()) {
            properties.forEach(p -> p.setDistanceFromSearchCenterMiles(null));
        }
        return properties.stream()
                .filter(p -> matches(p, filters))
                .toList();
    }

    boolean matches(ScoredProperty scored, PropertyFilters f) {
        Property p = scored.getProperty();

        if (f.getCity() != null && !contains(p.getCity(), f.getCity())) return false;
        if (f.getState() != null && !startsWith(p.getState(), f.getState())) return false;
        if (f.getPostalCode() != null && !startsWith(p.getPostalCode(), f.getPostalCode())) return false;
        if (f.getOwnerOccupancy() != null && p.getOwnerOccupancy() != f.getOwnerOccupancy()) return false;

        if (f.getMinEquity() != null && orZero(p.getEquityAvailable()) < f.getMinEquity()) return false;
        if (f.getMinValueGap() != null && orZero(p.getValueGap()) < f.getMinValueGap()) return false;

        double market = orZero(p.marketValueOrModel());
        if (f.getMinMarketValue() != null && market < f.getMinMarketValue()) return false;
        if (f.getMaxMarketValue() != null && market > f.getMaxMarketValue()) return false;

        double assessed = orZero(p.getTotalAssessedValue());
        if (f.getMinAssessedValue() != null && assessed < f.getMinAssessedValue()) return false;
        if (f.getMaxAssessedValue() != null && assessed > f.getMaxAssessedValue()) return false;

        if (f.getMinScore() != null && scored.getListingScore() < f.getMinScore()) return false;

        if (f.hasRadius() && !withinRadius(scored, f)) return false;

        return f.getSearch() == null || matchesSearch(p, f.getSearch());
    }

    private boolean withinRadius(ScoredProperty scored, PropertyFilters f) {
        Property p = scored.getProperty();
        if (p.getLatitude() == null || p.getLongitude() == null) return false;
        if (f.getCenterLatitude() == null || f.getCenterLongitude() == null) return false;

        double distance = GeoDistance.haversineMiles(
                f.getCenterLatitude(), f.getCenterLongitude(), p.getLatitude(), p.getLongitude());
        scored.setDistanceFromSearchCenterMiles(distance);
        return distance <= f.getRadiusMiles();
    }

    private boolean matchesSearch(Property p, String search) {
        String needle = search.toLowerCase(Locale.ROOT);
        OwnerContact owner = p.getOwner();
        return Stream.of(
                        p.getAddress(), p.getCity(), p.getState(),
                        owner.getName(), owner.getAddressLine1(), owner.getPhone(), owner.getEmail(),
                        p.getPropertyId(), p.getParcelId())
                .filter(Objects::nonNull)
                .anyMatch(hay -> hay.toLowerCase(Locale.ROOT).contains(needle));
    }

    private static boolean contains(String value, String query) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(query.toLowerCase(Locale.ROOT));
    }

    private static boolean startsWith(String value, String query) {
        return value != null && value.toLowerCase(Locale.ROOT).startsWith(query.toLowerCase(Locale.ROOT));
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
