package com.propertyintel.leads.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether the owner's mailing address matches the subject property.
 * Unknown occupancy is modelled as {@code null} on the property, never as a constant.
 */
public enum OwnerOccupancy {

    OWNER_OCCUPIED("owner_occupied"),
    ABSENTEE("absentee");

    private final String code;

    OwnerOccupancy(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Resolve a query parameter value. Accepts the wire codes plus {@code owner}
     * as shorthand for owner-occupied.
     *
     * @return the matching value, or {@code null} when the parameter is not recognised
     */
    public static OwnerOccupancy fromParam(String value) {
        if (value == null) return null;
        String key = value.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "owner_occupied", "owner" -> OWNER_OCCUPIED;
            case "absentee" -> ABSENTEE;
            default -> null;
        };
    }
}
