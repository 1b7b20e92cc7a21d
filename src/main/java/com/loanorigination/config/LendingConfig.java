package com.loanorigination.config;

import com.loanorigination.calculation.LoanCalculator;
import com.loanorigination.model.ApplicationStateMachine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the plain domain classes (calculation engine, state machine) with
 * the {@code lending.*} settings from application.yml.
 */
@Configuration
@Slf4j
public class LendingConfig {

    @Value("${lending.calculation.max-payments:1000}")
    private int maxPayments;

    @Value("${lending.calculation.cat-tolerance:1e-10}")
    private double catTolerance;

    @Value("${lending.calculation.cat-max-iterations:100}")
    private int catMaxIterations;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LoanCalculator loanCalculator() {
        log.info("Loan calculator: maxPayments={}, catTolerance={}, catMaxIterations={}",
                maxPayments, catTolerance, catMaxIterations);
        return new LoanCalculator(maxPayments, catTolerance, catMaxIterations);
    }

    @Bean
    public ApplicationStateMachine applicationStateMachine(LoanCalculator loanCalculator, Clock clock) {
        return new ApplicationStateMachine(loanCalculator, clock);
    }
}
