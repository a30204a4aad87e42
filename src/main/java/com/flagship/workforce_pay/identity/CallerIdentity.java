package com.flagship.workforce_pay.identity;

import lombok.Value;

/**
 * Authenticated caller as supplied by the gateway in front of this service.
 * {@code id} is the owning-account scope for every ownership check.
 */
@Value
public class CallerIdentity {
    public static final String DEFAULT_ROLE = "user";

    Long id;
    String role;
}
