package com.loanorigination.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Credit product offered by a tenant: the bounds a request must respect and
 * the pricing used to simulate it.
 */
@Entity
@Table(name = "products",
       indexes = {
           @Index(name = "idx_product_tenant", columnList = "tenantId")
       })
@Data
@NoArgsConstructor
public class Product {

    @Id
    private String productId;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal minAmount;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal maxAmount;

    @Column(nullable = false)
    private Integer minTermMonths;

    @Column(nullable = false)
    private Integer maxTermMonths;

    @Column(nullable = false, precision = 9, scale = 4)
    private BigDecimal annualRate;

    @Column(precision = 9, scale = 4)
    private BigDecimal openingCommissionRate = BigDecimal.ZERO;

    @Column(nullable = false)
    private boolean active = true;

    public boolean isAmountValid(BigDecimal amount) {
        return amount != null
                && amount.compareTo(minAmount) >= 0
                && amount.compareTo(maxAmount) <= 0;
    }

    public boolean isTermValid(int termMonths) {
        return termMonths >= minTermMonths && termMonths <= maxTermMonths;
    }
}
