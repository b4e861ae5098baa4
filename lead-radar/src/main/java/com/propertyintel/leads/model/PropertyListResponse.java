package com.propertyintel.leads.model;

import lombok.Value;

import java.util.List;

@Value
public class PropertyListResponse {

    List<ScoredProperty> items;
    int total;
    int limit;
    int offset;
}
