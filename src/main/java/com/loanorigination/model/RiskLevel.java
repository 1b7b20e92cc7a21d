package com.loanorigination.model;

/**
 * Risk levels recorded by the credit assessment.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH
}
