package com.flagship.workforce_pay.directory;

import lombok.Value;

import java.time.LocalDate;

/**
 * Read-only view of a project. Its status is informational only.
 */
@Value
public class Project {
    Long id;
    Long ownerId;
    String name;
    String category;
    LocalDate startDate;
    LocalDate endDate;
    String status;

    public boolean isOwnedBy(Long accountId) {
        return ownerId != null && ownerId.equals(accountId);
    }
}
