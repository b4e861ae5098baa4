package com.propertyintel.leads.config;

import com.propertyintel.leads.model.CacheStatus;
import com.propertyintel.leads.model.LeadPackResponse;
import com.propertyintel.leads.model.OwnerOccupancy;
import com.propertyintel.leads.model.PropertyFilters;
import com.propertyintel.leads.model.PropertyListResponse;
import com.propertyintel.leads.model.ScoredProperty;
import com.propertyintel.leads.output.PropertyCsvWriter;
import com.propertyintel.leads.scheduler.CacheRefreshScheduler;
import com.propertyintel.leads.service.InvalidFilterException;
import com.propertyintel.leads.service.PropertyService;
import com.propertyintel.leads.usage.UsageLimitExceededException;
import com.propertyintel.leads.usage.UsageMeter;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class PropertyController {

    static final String ACCOUNT_HEADER = "X-Account-Id";
    static final String USER_HEADER = "X-User-Id";

    private final PropertyService propertyService;
    private final CacheRefreshScheduler refreshScheduler;
    private final PropertyCsvWriter csvWriter;
    private final UsageMeter usageMeter;

    // ── Property queries ──────────────────────────────────────────────────────

    /**
     * Ranked, filtered, paginated properties.
     *
     * GET /api/properties?city=austin&min_equity=200000&limit=25
     */
    @GetMapping("/api/properties")
    public ResponseEntity<PropertyListResponse> listProperties(
            @RequestParam Map<String, String> params,
            @RequestHeader(value = ACCOUNT_HEADER, required = false) String accountId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        PropertyFilters filters = toFilters(params);
        PropertyListResponse response = propertyService.listProperties(filters);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("limit", filters.getLimit());
        payload.put("offset", filters.getOffset());
        payload.put("returned", response.getItems().size());
        payload.put("filters", params);
        recordUsage("properties.list", payload, Map.of("total_available", response.getTotal()), accountId, userId);

        return ResponseEntity.ok(response);
    }

    /**
     * Properties grouped into ranked lead packs.
     *
     * GET /api/properties/packs?group_by=zip&pack_size=50
     */
    @GetMapping("/api/properties/packs")
    public ResponseEntity<LeadPackResponse> leadPacks(
            @RequestParam Map<String, String> params,
            @RequestParam(name = "group_by", defaultValue = "postal_code") String groupBy,
            @RequestParam(name = "pack_size", defaultValue = "200") int packSize,
            @RequestHeader(value = ACCOUNT_HEADER, required = false) String accountId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        PropertyFilters filters = toFilters(params).toBuilder().offset(0).build();
        int size = Math.max(1, Math.min(500, packSize));
        usageMeter.ensureWithinPlan("properties.lead_pack", accountId);

        LeadPackResponse response = propertyService.generateLeadPacks(filters, groupBy, size);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("group_by", groupBy);
        payload.put("pack_size", size);
        payload.put("filters", params);
        payload.put("pack_count", response.getPacks().size());
        recordUsage("properties.lead_pack", payload, Map.of(), accountId, userId);

        return ResponseEntity.ok(response);
    }

    /**
     * Every matching property as a CSV attachment.
     *
     * GET /api/properties/export?state=TX
     */
    @GetMapping("/api/properties/export")
    public void export(
            @RequestParam Map<String, String> params,
            @RequestHeader(value = ACCOUNT_HEADER, required = false) String accountId,
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            HttpServletResponse response) throws IOException {
        PropertyFilters filters = toFilters(params);
        usageMeter.ensureWithinPlan("properties.export", accountId);

        List<ScoredProperty> properties = propertyService.exportProperties(filters);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("filters", params);
        payload.put("export_count", properties.size());
        recordUsage("properties.export", payload, Map.of(), accountId, userId);

        response.setStatus(HttpStatus.OK.value());
        response.setContentType("text/csv");
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setHeader(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"lead-radar-export.csv\"");
        response.setHeader("X-Property-Count", String.valueOf(properties.size()));
        csvWriter.write(properties, response.getWriter());
    }

    // ── Cache ─────────────────────────────────────────────────────────────────

    @PostMapping("/api/properties/refresh-cache")
    public ResponseEntity<Map<String, String>> refreshCache(
            @RequestHeader(value = ACCOUNT_HEADER, required = false) String accountId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        usageMeter.ensureWithinPlan("properties.refresh_cache", accountId);
        propertyService.refreshCache();
        recordUsage("properties.refresh_cache", Map.of(), Map.of(), accountId, userId);
        return ResponseEntity.accepted().body(Map.of("status", "cache refreshed"));
    }

    @GetMapping("/api/properties/cache/status")
    public ResponseEntity<Map<String, Object>> cacheStatus() {
        CacheStatus status = propertyService.cacheStatus();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "property-intel-lead-radar");
        body.put("cache", status);
        body.put("refresh_loop_running", refreshScheduler.isRunning());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    // ── Error mapping ─────────────────────────────────────────────────────────

    @ExceptionHandler(InvalidFilterException.class)
    public ResponseEntity<Map<String, String>> invalidFilter(InvalidFilterException e) {
        return ResponseEntity.unprocessableEntity().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(UsageLimitExceededException.class)
    public ResponseEntity<Map<String, String>> usageLimit(UsageLimitExceededException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> failure(Exception e) {
        log.error("Property request failed: {}", e.getMessage(), e);
        return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    // ── Internal ──────────────────────────────────────────────────────────────

    static PropertyFilters toFilters(Map<String, String> params) {
        String occupancy = PropertyFilters.clean(params.get("owner_occupancy"));
        OwnerOccupancy ownerOccupancy = OwnerOccupancy.fromParam(occupancy);
        if (occupancy != null && ownerOccupancy == null) {
            throw new InvalidFilterException("owner_occupancy must be owner_occupied or absentee");
        }

        PropertyFilters filters = PropertyFilters.builder()
                .city(PropertyFilters.clean(params.get("city")))
                .state(PropertyFilters.clean(params.get("state")))
                .postalCode(PropertyFilters.clean(params.get("postal_code")))
                .search(PropertyFilters.clean(params.get("search")))
                .minEquity(number(params, "min_equity"))
                .minScore(number(params, "min_score"))
                .minValueGap(number(params, "min_value_gap"))
                .minMarketValue(number(params, "min_market_value"))
                .maxMarketValue(number(params, "max_market_value"))
                .minAssessedValue(number(params, "min_assessed_value"))
                .maxAssessedValue(number(params, "max_assessed_value"))
                .ownerOccupancy(ownerOccupancy)
                .centerLatitude(number(params, "center_latitude"))
                .centerLongitude(number(params, "center_longitude"))
                .radiusMiles(number(params, "radius_miles"))
                .limit(PropertyFilters.clampLimit(integer(params, "limit")))
                .offset(PropertyFilters.clampOffset(integer(params, "offset")))
                .build();
        filters.validate();
        return filters;
    }

    private static Double number(Map<String, String> params, String name) {
        String value = PropertyFilters.clean(params.get(name));
        if (value == null) return null;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new InvalidFilterException(name + " must be a number");
        }
    }

    private static Integer integer(Map<String, String> params, String name) {
        String value = PropertyFilters.clean(params.get(name));
        if (value == null) return null;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidFilterException(name + " must be an integer");
        }
    }

    private void recordUsage(String eventType, Map<String, Object> payload, Map<String, Object> metadata,
                             String accountId, String userId) {
        try {
            usageMeter.logEvent(eventType, payload, metadata, accountId, userId);
        } catch (Exception e) {
            log.warn("Failed to record usage event {}: {}", eventType, e.getMessage());
        }
    }
}
