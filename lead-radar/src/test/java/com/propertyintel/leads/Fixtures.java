package com.propertyintel.leads;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Shared test data: four Texas parcels (three owner-occupied, one absentee) and
 * a clock pinned to 2024-06-01.
 */
public final class Fixtures {

    public static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private Fixtures() {
    }

    public static List<Map<String, Object>> sampleRecords() {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/realie-properties.json")) {
            return new ObjectMapper().readValue(in, new TypeReference<>() {});
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
