package com.propertyintel.leads.service;

import java.util.List;
import java.util.Map;

/**
 * Pull-based supplier of raw parcel records.
 */
public interface RawPropertySource {

    /**
     * Fetch a snapshot of at most {@code maxRecords} raw records. Implementations
     * may paginate internally and throw on an unrecoverable upstream failure.
     */
    List<Map<String, Object>> fetchAll(int maxRecords);
}
