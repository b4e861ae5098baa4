package com.propertyintel.leads.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * One page of the Realie property search response.
 * Records stay as raw maps; field mapping happens in the normalizer.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RealiePage {

    private List<Map<String, Object>> properties;
}
