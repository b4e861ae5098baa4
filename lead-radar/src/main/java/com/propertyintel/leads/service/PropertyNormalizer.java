package com.propertyintel.leads.service;

import com.propertyintel.leads.model.OwnerContact;
import com.propertyintel.leads.model.OwnerOccupancy;
import com.propertyintel.leads.model.Property;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maps raw Realie records onto the canonical {@link Property}.
 *
 * Field names vary between provider releases, so most attributes are resolved
 * through a list of candidate keys. Unparseable values become null; a single bad
 * record never fails a request.
 */
@Component
@Slf4j
public class PropertyNormalizer {

    private static final String EMPTY_DATE = "00000000";

    private static final DateTimeFormatter BASIC_DATE = DateTimeFormatter.ofPattern("uuuuMMdd")
            .withResolverStyle(ResolverStyle.STRICT);

    /** 2024-01-15, 2024-01-15T10:30:00 or 2024-01-15T10:30:00Z; only the date part is kept */
    private static final DateTimeFormatter ISO_DATE_OR_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    public Property normalize(Map<String, Object> raw) {
        String address = resolveAddress(raw);
        String id = firstText(raw, "_id", "id", "parcelId");

        Property property = Property.builder()
                .propertyId(id != null ? id : Objects.requireNonNullElse(address, "unknown"))
                .parcelId(text(raw.get("parcelId")))
                .address(address)
                .city(text(raw.get("city")))
                .state(text(raw.get("state")))
                .postalCode(firstText(raw, "zipCode", "zipCodePlusFour"))
                .neighborhood(text(raw.get("neighborhood")))
                .latitude(toDouble(raw.get("latitude")))
                .longitude(toDouble(raw.get("longitude")))
                .totalAssessedValue(toDouble(raw.get("totalAssessedValue")))
                .totalMarketValue(toDouble(raw.get("totalMarketValue")))
                .modelValue(toDouble(raw.get("modelValue")))
                .equityCurrentEstBal(toDouble(firstPresent(raw, "equityCurrentEstBal", "equityCurrentBalance")))
                .equityAvailable(toDouble(firstPresent(raw, "equityAvailable", "availableEquity", "equityCurrentEstBal")))
                .transferDate(parseDate(raw.get("transferDate")))
                .owner(buildOwner(raw))
                .build();

        property.setValueGap(valueGap(property));
        property.setOwnerOccupancy(ownerOccupancy(property));
        return property;
    }

    // ── Derived fields ───────────────────────────────────────────────────────

    static Double valueGap(Property p) {
        Double market = p.getModelValue() != null ? p.getModelValue() : p.getTotalMarketValue();
        Double assessed = p.getTotalAssessedValue();
        if (market == null || assessed == null) return null;
        return Math.max(market - assessed, 0.0);
    }

    /**
     * Compare the property's (address, city, state, postal code) with the owner's
     * mailing tuple. Any empty component on either side leaves occupancy unknown.
     */
    static OwnerOccupancy ownerOccupancy(Property p) {
        OwnerContact owner = p.getOwner();
        String[] site = {
                fold(p.getAddress()), fold(p.getCity()), fold(p.getState()), fold(p.getPostalCode())
        };
        String[] mailing = {
                fold(owner.getAddressLine1()), fold(owner.getCity()), fold(owner.getState()), fold(owner.getPostalCode())
        };
        boolean complete = Arrays.stream(site).noneMatch(String::isEmpty)
                && Arrays.stream(mailing).noneMatch(String::isEmpty);
        if (!complete) return null;
        return Arrays.equals(site, mailing) ? OwnerOccupancy.OWNER_OCCUPIED : OwnerOccupancy.ABSENTEE;
    }

    // ── Field resolution ─────────────────────────────────────────────────────

    private String resolveAddress(Map<String, Object> raw) {
        String address = firstText(raw, "addressFull", "addressFormal", "address", "addressRaw");
        if (address != null) return address;

        String composed = Stream.of(
                        "streetNumber", "streetDirectionPrefix", "streetName", "streetType", "streetDirectionSuffix")
                .map(key -> text(raw.get(key)))
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" "));
        return composed.isEmpty() ? null : composed;
    }

    private OwnerContact buildOwner(Map<String, Object> raw) {
        return OwnerContact.builder()
                .name(firstText(raw, "ownerName", "owner1FullName"))
                .addressLine1(firstText(raw, "ownerAddressLine1", "ownerMailingAddress"))
                .city(text(raw.get("ownerCity")))
                .state(text(raw.get("ownerState")))
                .postalCode(text(raw.get("ownerZipCode")))
                .phone(text(raw.get("ownerPhone")))
                .email(text(raw.get("ownerEmail")))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String firstText(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            String value = text(raw.get(key));
            if (value != null) return value;
        }
        return null;
    }

    private static Object firstPresent(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            Object value = raw.get(key);
            if (value != null && !(value instanceof String s && s.isBlank())) return value;
        }
        return null;
    }

    static String text(Object val) {
        if (val == null) return null;
        String s = val instanceof Number n ? plainNumber(n) : val.toString().trim();
        return s.isEmpty() ? null : s;
    }

    static Double toDouble(Object val) {
        if (val == null) return null;
        double parsed;
        if (val instanceof Number n) {
            parsed = n.doubleValue();
        } else if (val instanceof String s) {
            if (s.isBlank()) return null;
            try {
                parsed = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(parsed) ? parsed : null;
    }

    /**
     * Accepts yyyyMMdd (as text or an integral number) or ISO-8601 date, date-time
     * and offset date-time. Anything else, including "00000000", yields null.
     */
    static LocalDate parseDate(Object val) {
        String s = val instanceof Number n ? plainNumber(n) : text(val);
        if (s == null || EMPTY_DATE.equals(s)) return null;

        try {
            if (s.length() == 8 && s.chars().allMatch(Character::isDigit)) {
                return LocalDate.parse(s, BASIC_DATE);
            }
            return LocalDate.parse(s, ISO_DATE_OR_DATE_TIME);
        } catch (DateTimeParseException e) {
            log.debug("Could not parse transfer date: {}", s);
            return null;
        }
    }

    private static String plainNumber(Number n) {
        if (n instanceof Double d && (d.isNaN() || d.isInfinite())) return "";
        if (n instanceof Float f && (f.isNaN() || f.isInfinite())) return "";
        return new BigDecimal(n.toString()).stripTrailingZeros().toPlainString();
    }

    private static String fold(String val) {
        return val == null ? "" : val.trim().toLowerCase(Locale.ROOT);
    }
}
