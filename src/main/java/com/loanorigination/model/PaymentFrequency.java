package com.loanorigination.model;

import java.util.Locale;

/**
 * How often the borrower pays. Billing math uses the exact per-year counts.
 */
public enum PaymentFrequency {
    WEEKLY(52, "Semanal", "SEMANAL"),
    BIWEEKLY(24, "Quincenal", "QUINCENAL"),
    MONTHLY(12, "Mensual", "MENSUAL");

    private final int paymentsPerYear;
    private final String label;
    private final String legacyAlias;

    PaymentFrequency(int paymentsPerYear, String label, String legacyAlias) {
        this.paymentsPerYear = paymentsPerYear;
        this.label = label;
        this.legacyAlias = legacyAlias;
    }

    public int getPaymentsPerYear() {
        return paymentsPerYear;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolves a frequency from its name or the Spanish alias older clients send.
     *
     * @return the frequency, or null when the value is not recognised
     */
    public static PaymentFrequency normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String upper = value.trim().toUpperCase(Locale.ROOT);
        for (PaymentFrequency frequency : values()) {
            if (frequency.name().equals(upper) || frequency.legacyAlias.equals(upper)) {
                return frequency;
            }
        }
        return null;
    }
}
