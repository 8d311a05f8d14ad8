package com.example.cafeshift.breaks;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BreakPolicyResolverTest {

    private static final BreakSpec COFFEE = new BreakSpec(BreakType.COFFEE, 15, true, false);
    private static final BreakSpec LUNCH = new BreakSpec(BreakType.LUNCH, 30, false, true);
    private static final BreakSpec MEAL = new BreakSpec(BreakType.MEAL, 30, false, true);

    private final BreakPolicyResolver resolver = new BreakPolicyResolver(List.of(
            new BreakPolicy(0, List.of()),
            new BreakPolicy(240, List.of(COFFEE)),
            new BreakPolicy(360, List.of(LUNCH, COFFEE)),
            new BreakPolicy(480, List.of(LUNCH, MEAL, COFFEE))));

    @Test
    void resolve_picksGreatestMinimumNotAboveLength() {
        assertThat(resolver.resolve(239)).isEmpty();
        assertThat(resolver.resolve(240)).containsExactly(COFFEE);
        assertThat(resolver.resolve(420)).containsExactly(LUNCH, COFFEE);
        assertThat(resolver.resolve(540)).containsExactly(LUNCH, MEAL, COFFEE);
    }

    @Test
    void resolve_nonPositiveLengthHasNoBreaks() {
        assertThat(resolver.resolve(0)).isEmpty();
        assertThat(resolver.resolve(-30)).isEmpty();
    }

    @Test
    void resolve_firstPolicyWinsOnEqualMinimum() {
        BreakPolicyResolver tied = new BreakPolicyResolver(List.of(
                new BreakPolicy(300, List.of(LUNCH)),
                new BreakPolicy(300, List.of(COFFEE))));

        assertThat(tied.resolve(320)).containsExactly(LUNCH);
    }

    @Test
    void required_keepsOnlyMandatoryBreaks() {
        assertThat(resolver.required(480)).containsExactly(LUNCH, MEAL);
        assertThat(resolver.required(250)).isEmpty();
    }

    @Test
    void plan_placesBreaksAfterFirstThirdBackToBack() {
        LocalDateTime start = LocalDateTime.of(2025, 6, 2, 9, 0);
        List<BreakPolicyResolver.PlannedBreak> plan = resolver.plan(start, start.plusHours(9));

        assertThat(plan).hasSize(3);
        assertThat(plan.get(0).start()).isEqualTo(LocalDateTime.of(2025, 6, 2, 12, 0));
        assertThat(plan.get(0).end()).isEqualTo(LocalDateTime.of(2025, 6, 2, 12, 30));
        assertThat(plan.get(1).start()).isEqualTo(plan.get(0).end());
        assertThat(plan.get(2).spec()).isEqualTo(COFFEE);
        assertThat(plan.get(2).end()).isEqualTo(LocalDateTime.of(2025, 6, 2, 13, 15));
    }
}
