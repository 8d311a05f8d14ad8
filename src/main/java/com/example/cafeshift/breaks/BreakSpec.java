package com.example.cafeshift.breaks;

/**
 * One break a policy asks for.
 *
 * @param durationMinutes length of the break
 * @param paid            paid breaks count as worked time
 * @param required        required breaks are always planned; others are suggestions
 */
public record BreakSpec(BreakType type, int durationMinutes, boolean paid, boolean required) {
}
