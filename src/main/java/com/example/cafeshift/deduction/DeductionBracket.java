package com.example.cafeshift.deduction;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "deduction_brackets", indexes = {
        @Index(name = "idx_bracket_type_effective", columnList = "type,effective_from,min_salary")
})
public class DeductionBracket {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DeductionType type;

    @Column(name = "min_salary", nullable = false, precision = 14, scale = 2)
    private BigDecimal minSalary;

    /** Null for the open-ended top bracket. */
    @Column(name = "max_salary", precision = 14, scale = 2)
    private BigDecimal maxSalary;

    /** Percentage of the salary basis; mutually exclusive with {@link #fixedContribution}. */
    @Column(precision = 7, scale = 4)
    private BigDecimal rate;

    @Column(name = "fixed_contribution", precision = 12, scale = 2)
    private BigDecimal fixedContribution;

    @Column(name = "effective_from", nullable = false)
    private LocalDate effectiveFrom;

    @Column(length = 200)
    private String description;

    @Column(nullable = false)
    private Boolean active = true;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected DeductionBracket() {
    }

    public DeductionBracket(DeductionType type, LocalDate effectiveFrom, BigDecimal minSalary, BigDecimal maxSalary,
                            BigDecimal rate, BigDecimal fixedContribution, String description) {
        this.type = type;
        this.effectiveFrom = effectiveFrom;
        this.minSalary = minSalary;
        this.maxSalary = maxSalary;
        this.rate = rate;
        this.fixedContribution = fixedContribution;
        this.description = description;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    public Long getId() { return id; }
    public DeductionType getType() { return type; }
    public BigDecimal getMinSalary() { return minSalary; }
    public BigDecimal getMaxSalary() { return maxSalary; }
    public BigDecimal getRate() { return rate; }
    public BigDecimal getFixedContribution() { return fixedContribution; }
    public LocalDate getEffectiveFrom() { return effectiveFrom; }
    public String getDescription() { return description; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
