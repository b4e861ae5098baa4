package com.propertyintel.leads.service;

import com.propertyintel.leads.model.GroupBy;
import com.propertyintel.leads.model.LeadPack;
import com.propertyintel.leads.model.Property;
import com.propertyintel.leads.model.ScoreBreakdown;
import com.propertyintel.leads.model.ScoredProperty;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LeadPackBuilderTest {

    private final LeadPackBuilder builder = new LeadPackBuilder();

    private final List<ScoredProperty> pool = List.of(
            scored("a1", "Austin", "73301", 40),
            scored("a2", "Austin", "73301", 90),
            scored("a3", "Austin", "78701", 70),
            scored("d1", "Dallas", "75201", 95),
            scored("x1", "Austin", null, 20),
            scored("x2", "Austin", " ", 10));

    @Test
    void totalsAddUpToInput() {
        List<LeadPack> packs = builder.build(pool, GroupBy.POSTAL_CODE, 1);
        assertEquals(pool.size(), packs.stream().mapToInt(LeadPack::getTotal).sum());
    }

    @Test
    void blankValuesLandInUnclassified() {
        LeadPack unclassified = builder.build(pool, GroupBy.POSTAL_CODE, 10).stream()
                .filter(p -> p.getLabel().equals(LeadPackBuilder.UNCLASSIFIED))
                .findFirst()
                .orElseThrow();

        assertEquals(2, unclassified.getTotal());
        assertEquals(List.of("x1", "x2"), ids(unclassified));
    }

    @Test
    void packsAreTruncatedAndSortedByScore() {
        List<LeadPack> packs = builder.build(pool, GroupBy.CITY, 2);

        assertEquals(List.of("Dallas", "Austin"), packs.stream().map(LeadPack::getLabel).toList());
        LeadPack austin = packs.get(1);
        assertEquals(5, austin.getTotal());
        assertEquals(List.of("a2", "a3"), ids(austin));
    }

    @Test
    void packsOrderedByTopScore() {
        List<LeadPack> packs = builder.build(pool, GroupBy.POSTAL_CODE, 5);
        for (int i = 1; i < packs.size(); i++) {
            assertTrue(packs.get(i - 1).topScore() >= packs.get(i).topScore());
        }
        assertEquals("75201", packs.get(0).getLabel());
    }

    @Test
    void emptyInputGivesNoPacks() {
        assertTrue(builder.build(List.of(), GroupBy.STATE, 10).isEmpty());
    }

    private static ScoredProperty scored(String id, String city, String postalCode, double score) {
        Property p = Property.builder().propertyId(id).city(city).state("TX").postalCode(postalCode).build();
        return new ScoredProperty(p, score, new ScoreBreakdown(0, 0, 0));
    }

    private static List<String> ids(LeadPack pack) {
        return pack.getTopProperties().stream().map(s -> s.getProperty().getPropertyId()).toList();
    }
}
