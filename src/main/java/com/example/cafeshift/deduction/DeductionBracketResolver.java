package com.example.cafeshift.deduction;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;

@Component
public class DeductionBracketResolver {

    private final DeductionBracketCatalog catalog;

    public DeductionBracketResolver(DeductionBracketCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Contribution of {@code type} owed on {@code salary} under the table in force on {@code asOf}.
     *
     * @throws com.example.cafeshift.exception.ComputationException when no table or bracket applies
     */
    public BigDecimal resolve(DeductionType type, BigDecimal salary, LocalDate asOf) {
        return catalog.schedule(type).tableAsOf(asOf).contributionFor(salary);
    }
}
