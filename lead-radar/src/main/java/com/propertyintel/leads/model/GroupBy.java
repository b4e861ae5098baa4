package com.propertyintel.leads.model;

import java.util.Locale;
import java.util.function.Function;

/**
 * Attributes lead packs can be grouped by, each with an explicit accessor.
 */
public enum GroupBy {

    POSTAL_CODE(Property::getPostalCode),
    CITY(Property::getCity),
    STATE(Property::getState);

    private final Function<Property, String> accessor;

    GroupBy(Function<Property, String> accessor) {
        this.accessor = accessor;
    }

    public String labelOf(Property property) {
        return accessor.apply(property);
    }

    /**
     * Resolve a group_by parameter. {@code zip} and {@code zip_code} alias postal_code.
     *
     * @return the matching key, or {@code null} when the parameter is not recognised
     */
    public static GroupBy fromParam(String value) {
        if (value == null) return null;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "postal_code", "zip", "zip_code" -> POSTAL_CODE;
            case "city" -> CITY;
            case "state" -> STATE;
            default -> null;
        };
    }
}
