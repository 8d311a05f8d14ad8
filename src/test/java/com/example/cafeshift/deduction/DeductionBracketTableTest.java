package com.example.cafeshift.deduction;

import com.example.cafeshift.exception.ComputationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeductionBracketTableTest {

    private static final LocalDate EFFECTIVE = LocalDate.of(2024, 1, 1);

    @Test
    void contributionFor_matchesInclusiveBoundsAndRoundsHalfUp() {
        DeductionBracketTable table = DeductionBracketTable.of(DeductionType.PHILHEALTH, EFFECTIVE, List.of(
                fixed("0", "9999.99", "250"),
                rate("10000", "99999.99", "2.5"),
                fixed("100000", null, "2500")));

        assertThat(table.contributionFor(new BigDecimal("9999.99"))).isEqualTo(new BigDecimal("250.00"));
        assertThat(table.contributionFor(new BigDecimal("10000.00"))).isEqualTo(new BigDecimal("250.00"));
        assertThat(table.contributionFor(new BigDecimal("12345.67"))).isEqualTo(new BigDecimal("308.64"));
        assertThat(table.contributionFor(new BigDecimal("5000000"))).isEqualTo(new BigDecimal("2500.00"));
    }

    @Test
    void of_sortsRowsByMinimum() {
        DeductionBracketTable table = DeductionBracketTable.of(DeductionType.SSS, EFFECTIVE, List.of(
                fixed("500", null, "20"),
                fixed("0", "499.99", "10")));

        assertThat(table.getRows()).extracting(DeductionBracketTable.Row::minSalary)
                .containsExactly(new BigDecimal("0"), new BigDecimal("500"));
    }

    @Test
    void of_rejectsGapBetweenBrackets() {
        assertThatThrownBy(() -> DeductionBracketTable.of(DeductionType.SSS, EFFECTIVE, List.of(
                fixed("0", "499.99", "10"),
                fixed("600", null, "20"))))
                .isInstanceOf(ComputationException.class)
                .hasMessageContaining("gap or overlap");
    }

    @Test
    void of_rejectsOverlappingBrackets() {
        assertThatThrownBy(() -> DeductionBracketTable.of(DeductionType.SSS, EFFECTIVE, List.of(
                fixed("0", "500", "10"),
                fixed("500", null, "20"))))
                .isInstanceOf(ComputationException.class);
    }

    @Test
    void of_rejectsTableNotStartingAtZero() {
        assertThatThrownBy(() -> DeductionBracketTable.of(DeductionType.TAX, EFFECTIVE, List.of(
                rate("100", null, "5"))))
                .isInstanceOf(ComputationException.class)
                .hasMessageContaining("start at 0");
    }

    @Test
    void of_rejectsOpenEndedBracketBeforeTheLast() {
        assertThatThrownBy(() -> DeductionBracketTable.of(DeductionType.TAX, EFFECTIVE, List.of(
                rate("0", null, "0"),
                rate("0.01", null, "5"))))
                .isInstanceOf(ComputationException.class);
    }

    @Test
    void of_requiresExactlyOneOfRateAndFixed() {
        assertThatThrownBy(() -> DeductionBracketTable.of(DeductionType.PAGIBIG, EFFECTIVE, List.of(
                new DeductionBracketTable.Row(new BigDecimal("0"), null, new BigDecimal("2"), new BigDecimal("100"), "both"))))
                .isInstanceOf(ComputationException.class);
        assertThatThrownBy(() -> DeductionBracketTable.of(DeductionType.PAGIBIG, EFFECTIVE, List.of(
                new DeductionBracketTable.Row(new BigDecimal("0"), null, null, null, "neither"))))
                .isInstanceOf(ComputationException.class);
    }

    @Test
    void contributionFor_negativeSalaryIsABracketGap() {
        DeductionBracketTable table = DeductionBracketTable.of(DeductionType.SSS, EFFECTIVE, List.of(
                fixed("0", null, "10")));

        assertThatThrownBy(() -> table.contributionFor(new BigDecimal("-1")))
                .isInstanceOf(ComputationException.class)
                .hasMessageContaining("Bracket gap");
    }

    private static DeductionBracketTable.Row fixed(String min, String max, String amount) {
        return new DeductionBracketTable.Row(new BigDecimal(min), max == null ? null : new BigDecimal(max),
                null, new BigDecimal(amount), null);
    }

    private static DeductionBracketTable.Row rate(String min, String max, String rate) {
        return new DeductionBracketTable.Row(new BigDecimal(min), max == null ? null : new BigDecimal(max),
                new BigDecimal(rate), null, null);
    }
}
