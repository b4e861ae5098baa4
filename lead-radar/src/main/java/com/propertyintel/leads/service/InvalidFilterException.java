package com.propertyintel.leads.service;

/**
 * Raised for a filter combination that cannot be evaluated. Always thrown
 * before the property cache is touched.
 */
public class InvalidFilterException extends IllegalArgumentException {

    public InvalidFilterException(String message) {
        super(message);
    }
}
