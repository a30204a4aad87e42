package com.flagship.workforce_pay.directory;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Read-only view of a worker owned by a project-owner account.
 */
@Value
public class Worker {
    Long id;
    Long ownerId;
    String fullname;
    String position;
    BigDecimal salary;

    public boolean isOwnedBy(Long accountId) {
        return ownerId != null && ownerId.equals(accountId);
    }
}
