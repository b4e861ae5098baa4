package com.propertyintel.leads.usage;

public class UsageLimitExceededException extends RuntimeException {

    public UsageLimitExceededException(String message) {
        super(message);
    }
}
