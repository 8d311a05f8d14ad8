package com.example.cafeshift.deduction;

import com.example.cafeshift.exception.ComputationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One validated version of a bracket table. Brackets start at zero, are sorted by minimum salary
 * and follow each other without gaps at centavo granularity; only the last may be open-ended.
 */
public final class DeductionBracketTable {

    private static final BigDecimal CENTAVO = new BigDecimal("0.01");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final DeductionType type;
    private final LocalDate effectiveFrom;
    private final List<Row> rows;

    private DeductionBracketTable(DeductionType type, LocalDate effectiveFrom, List<Row> rows) {
        this.type = type;
        this.effectiveFrom = effectiveFrom;
        this.rows = rows;
    }

    /**
     * One bracket. Exactly one of {@code rate} (a percentage) and {@code fixedContribution} is set.
     */
    public record Row(BigDecimal minSalary, BigDecimal maxSalary, BigDecimal rate,
                      BigDecimal fixedContribution, String description) {

        boolean matches(BigDecimal salary) {
            return minSalary.compareTo(salary) <= 0 && (maxSalary == null || salary.compareTo(maxSalary) <= 0);
        }

        BigDecimal contribution(BigDecimal salary) {
            if (rate != null) {
                return salary.multiply(rate).divide(HUNDRED, 2, RoundingMode.HALF_UP);
            }
            return fixedContribution.setScale(2, RoundingMode.HALF_UP);
        }
    }

    /**
     * @throws ComputationException when the rows do not form a valid table
     */
    public static DeductionBracketTable of(DeductionType type, LocalDate effectiveFrom, List<Row> rows) {
        if (type == null || effectiveFrom == null) {
            throw new ComputationException("Bracket table needs a type and an effective date");
        }
        if (rows == null || rows.isEmpty()) {
            throw new ComputationException("Bracket table %s effective %s is empty", type, effectiveFrom);
        }
        List<Row> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparing(Row::minSalary));

        if (sorted.get(0).minSalary().signum() != 0) {
            throw new ComputationException("Bracket table %s effective %s must start at 0", type, effectiveFrom);
        }
        for (int i = 0; i < sorted.size(); i++) {
            Row row = sorted.get(i);
            if ((row.rate() == null) == (row.fixedContribution() == null)) {
                throw new ComputationException("Bracket %s of %s needs either a rate or a fixed contribution",
                        row.minSalary(), type);
            }
            if ((row.rate() != null && row.rate().signum() < 0)
                    || (row.fixedContribution() != null && row.fixedContribution().signum() < 0)) {
                throw new ComputationException("Bracket %s of %s has a negative amount", row.minSalary(), type);
            }
            boolean last = i == sorted.size() - 1;
            if (row.maxSalary() == null) {
                if (!last) {
                    throw new ComputationException("Only the last %s bracket may be open-ended", type);
                }
                continue;
            }
            if (row.maxSalary().compareTo(row.minSalary()) < 0) {
                throw new ComputationException("Bracket %s of %s ends before it starts", row.minSalary(), type);
            }
            if (!last) {
                BigDecimal expectedNext = row.maxSalary().add(CENTAVO);
                BigDecimal next = sorted.get(i + 1).minSalary();
                if (next.compareTo(expectedNext) != 0) {
                    throw new ComputationException("Bracket table %s has a gap or overlap between %s and %s",
                            type, row.maxSalary(), next);
                }
            }
        }
        return new DeductionBracketTable(type, effectiveFrom, List.copyOf(sorted));
    }

    /**
     * Contribution owed for {@code salary}, rounded half-up to centavos.
     *
     * @throws ComputationException when no bracket covers the salary
     */
    public BigDecimal contributionFor(BigDecimal salary) {
        BigDecimal normalized = salary.setScale(2, RoundingMode.HALF_UP);
        for (Row row : rows) {
            if (row.matches(normalized)) {
                return row.contribution(normalized);
            }
        }
        throw new ComputationException("Bracket gap: no %s bracket covers salary %s", type, normalized);
    }

    public DeductionType getType() { return type; }
    public LocalDate getEffectiveFrom() { return effectiveFrom; }
    public List<Row> getRows() { return rows; }
}
