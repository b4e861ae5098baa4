package com.propertyintel.leads.output;

import com.opencsv.CSVReader;
import com.propertyintel.leads.model.OwnerContact;
import com.propertyintel.leads.model.OwnerOccupancy;
import com.propertyintel.leads.model.Property;
import com.propertyintel.leads.model.ScoreBreakdown;
import com.propertyintel.leads.model.ScoredProperty;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PropertyCsvWriterTest {

    private final PropertyCsvWriter writer = new PropertyCsvWriter();

    @Test
    void writesHeaderAndOneRowPerProperty() throws Exception {
        Property property = Property.builder()
                .propertyId("prop-4")
                .address("321 Absentee Ave, Suite 2")
                .city("Austin")
                .state("TX")
                .postalCode("78701")
                .totalAssessedValue(275000.0)
                .modelValue(420000.0)
                .equityAvailable(200000.0)
                .valueGap(145000.0)
                .ownerOccupancy(OwnerOccupancy.ABSENTEE)
                .owner(OwnerContact.builder().name("Investor Owner").city("Houston").build())
                .build();
        ScoredProperty scored = new ScoredProperty(property, 63.66, new ScoreBreakdown(0.6, 0.6279, 0.7342));
        scored.setDistanceFromSearchCenterMiles(1.5);

        List<String[]> rows = roundTrip(List.of(scored));

        assertEquals(2, rows.size());
        assertArrayEquals(PropertyCsvWriter.HEADERS, rows.get(0));

        String[] row = rows.get(1);
        assertEquals(PropertyCsvWriter.HEADERS.length, row.length);
        assertEquals("prop-4", row[0]);
        assertEquals("321 Absentee Ave, Suite 2", row[1]);
        assertEquals("Investor Owner", row[5]);
        assertEquals("", row[6]);
        assertEquals("420000.0", row[13]);
        assertEquals("absentee", row[16]);
        assertEquals("63.66", row[17]);
        assertEquals("1.5", row[18]);
    }

    @Test
    void missingValuesAreEmptyCells() throws Exception {
        ScoredProperty bare = new ScoredProperty(Property.builder().propertyId("x").build(), 0.0,
                new ScoreBreakdown(0, 0, 0));

        String[] row = roundTrip(List.of(bare)).get(1);

        assertEquals("", row[13]);
        assertEquals("", row[16]);
        assertEquals("", row[18]);
    }

    @Test
    void largeValuesAreWrittenWithoutExponent() throws Exception {
        Property estate = Property.builder()
                .propertyId("big")
                .totalAssessedValue(12_500_000.0)
                .totalMarketValue(15_000_000.0)
                .equityAvailable(10_000_000.0)
                .valueGap(2_500_000.0)
                .build();

        String[] row = roundTrip(List.of(new ScoredProperty(estate, 71.5, new ScoreBreakdown(1, 1, 0)))).get(1);

        assertEquals("12500000", row[12]);
        assertEquals("15000000", row[13]);
        assertEquals("10000000", row[14]);
        assertEquals("2500000.0", row[15]);
        assertEquals("71.5", row[17]);
        for (String cell : row) {
            assertFalse(cell.contains("E"), cell);
        }
    }

    @Test
    void emptyExportIsHeaderOnly() throws Exception {
        assertEquals(1, roundTrip(List.of()).size());
    }

    private List<String[]> roundTrip(List<ScoredProperty> properties) throws Exception {
        StringWriter out = new StringWriter();
        writer.write(properties, out);
        try (CSVReader reader = new CSVReader(new StringReader(out.toString()))) {
            return reader.readAll();
        }
    }
}
