package com.propertyintel.leads.model;

import lombok.Builder;
import lombok.Data;

/**
 * Owner mailing contact as reported by the data provider. Every field is optional.
 */
@Data
@Builder
public class OwnerContact {

    private String name;
    private String addressLine1;
    private String city;
    private String state;
    private String postalCode;
    private String phone;
    private String email;
}
