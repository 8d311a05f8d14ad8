package com.example.cafeshift.breaks;

import com.example.cafeshift.config.CafeProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Break heuristics shared by shift planning and the API, driven by the configured policy table.
 */
@Component
public class BreakPolicyResolver {

    private final List<BreakPolicy> policies;

    @Autowired
    public BreakPolicyResolver(CafeProperties properties) {
        this(properties.getBreaks().getPolicies().stream()
                .map(p -> new BreakPolicy(p.getMinShiftLength(), p.getBreaks().stream()
                        .map(b -> new BreakSpec(b.getType(), b.getDuration(), b.isPaid(), b.isRequired()))
                        .toList()))
                .toList());
    }

    public BreakPolicyResolver(List<BreakPolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    /**
     * Returns the breaks of the single policy with the greatest minimum length not above the
     * shift length. Equal minimums keep table order, so the first one declared wins.
     */
    public List<BreakSpec> resolve(long shiftMinutes) {
        if (shiftMinutes <= 0) {
            return List.of();
        }
        BreakPolicy best = null;
        for (BreakPolicy policy : policies) {
            if (policy.minShiftLength() > shiftMinutes) {
                continue;
            }
            if (best == null || policy.minShiftLength() > best.minShiftLength()) {
                best = policy;
            }
        }
        return best == null ? List.of() : best.breaks();
    }

    public List<BreakSpec> required(long shiftMinutes) {
        return resolve(shiftMinutes).stream().filter(BreakSpec::required).toList();
    }

    /**
     * Lays the resolved breaks out inside the shift window. The first break starts after a third
     * of the shift, the rest follow back to back; breaks that would run past the end are dropped.
     */
    public List<PlannedBreak> plan(LocalDateTime shiftStart, LocalDateTime shiftEnd) {
        if (shiftStart == null || shiftEnd == null || !shiftEnd.isAfter(shiftStart)) {
            return List.of();
        }
        long duration = Duration.between(shiftStart, shiftEnd).toMinutes();
        List<BreakSpec> specs = resolve(duration);
        List<PlannedBreak> planned = new ArrayList<>();
        LocalDateTime cursor = shiftStart.plusMinutes(duration / 3);
        for (BreakSpec spec : specs) {
            LocalDateTime end = cursor.plusMinutes(spec.durationMinutes());
            if (end.isAfter(shiftEnd)) {
                break;
            }
            planned.add(new PlannedBreak(spec, cursor, end));
            cursor = end;
        }
        return planned;
    }

    public record PlannedBreak(BreakSpec spec, LocalDateTime start, LocalDateTime end) {
    }
}
