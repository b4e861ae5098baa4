package com.propertyintel.leads.output;

import com.opencsv.CSVWriter;
import com.propertyintel.leads.model.OwnerContact;
import com.propertyintel.leads.model.Property;
import com.propertyintel.leads.model.ScoredProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.List;

/**
 * Writes scored properties as a CSV lead sheet.
 *
 * Column order is fixed; absent values are written as empty cells. The market
 * value column falls back to the model value when no total market value is known.
 */
@Component
@Slf4j
public class PropertyCsvWriter {

    static final String[] HEADERS = {
            "property_id", "address", "city", "state", "postal_code",
            "owner_name", "owner_address", "owner_city", "owner_state", "owner_postal_code",
            "owner_phone", "owner_email",
            "total_assessed_value", "total_market_value",
            "equity_available", "value_gap", "owner_occupancy",
            "listing_score", "distance_from_search_center_miles"
    };

    public void write(List<ScoredProperty> properties, Writer out) {
        try (CSVWriter writer = new CSVWriter(
                out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(HEADERS);
            for (ScoredProperty p : properties) {
                writer.writeNext(toRow(p));
            }
            writer.flush();
            log.info("Exported {} properties to CSV", properties.size());

        } catch (IOException e) {
            log.error("Failed to write CSV export: {}", e.getMessage(), e);
            throw new UncheckedIOException("CSV export failed", e);
        }
    }

    private String[] toRow(ScoredProperty scored) {
        Property p = scored.getProperty();
        OwnerContact owner = p.getOwner();
        return new String[]{
                str(p.getPropertyId()),
                str(p.getAddress()),
                str(p.getCity()),
                str(p.getState()),
                str(p.getPostalCode()),
                str(owner.getName()),
                str(owner.getAddressLine1()),
                str(owner.getCity()),
                str(owner.getState()),
                str(owner.getPostalCode()),
                str(owner.getPhone()),
                str(owner.getEmail()),
                str(p.getTotalAssessedValue()),
                str(p.marketValueOrModel()),
                str(p.getEquityAvailable()),
                str(p.getValueGap()),
                p.getOwnerOccupancy() == null ? "" : p.getOwnerOccupancy().code(),
                str(scored.getListingScore()),
                str(scored.getDistanceFromSearchCenterMiles())
        };
    }

    private String str(Object val) {
        if (val == null) return "";
        // plain digits, never 1.25E7
        if (val instanceof Double d && Double.isFinite(d)) return BigDecimal.valueOf(d).toPlainString();
        return val.toString();
    }
}
