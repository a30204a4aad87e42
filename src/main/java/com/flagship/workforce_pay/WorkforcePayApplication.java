package com.flagship.workforce_pay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Attendance ledger and payment request engine for project owners' workforces.
 */
@SpringBootApplication
public class WorkforcePayApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkforcePayApplication.class, args);
    }
}
