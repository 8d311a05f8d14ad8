package com.example.cafeshift.deduction;

import com.example.cafeshift.exception.ComputationException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Every version of one deduction type's bracket table, keyed by effective date.
 */
public final class DeductionSchedule {

    private final DeductionType type;
    private final NavigableMap<LocalDate, DeductionBracketTable> versions;

    public DeductionSchedule(DeductionType type, Map<LocalDate, DeductionBracketTable> versions) {
        this.type = type;
        this.versions = Collections.unmodifiableNavigableMap(new TreeMap<>(versions));
    }

    /**
     * Version with the latest effective date on or before {@code asOf}.
     */
    public DeductionBracketTable tableAsOf(LocalDate asOf) {
        Map.Entry<LocalDate, DeductionBracketTable> entry = versions.floorEntry(asOf);
        if (entry == null) {
            throw new ComputationException("No %s bracket table is effective on %s", type, asOf);
        }
        return entry.getValue();
    }

    public List<DeductionBracketTable> versions() {
        return new ArrayList<>(versions.values());
    }

    public DeductionType getType() {
        return type;
    }
}
