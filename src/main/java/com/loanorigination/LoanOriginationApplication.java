package com.loanorigination;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Loan origination core: application lifecycle and loan simulation.
 *
 * Scheduling runs the outbox publisher and its monitor.
 */
@SpringBootApplication
@EnableScheduling
public class LoanOriginationApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoanOriginationApplication.class, args);
    }
}
