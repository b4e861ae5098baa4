package com.propertyintel.leads.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class LeadPackResponse {

    Instant generatedAt;
    List<LeadPack> packs;
}
