package com.example.cafeshift.holiday;

import jakarta.persistence.*;

import java.time.LocalDate;

/**
 * A calendar date whose worked hours earn a holiday premium. At most one holiday per date.
 */
@Entity
@Table(name = "holidays")
public class Holiday {

    static final int MAX_NAME_LENGTH = 64;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "holiday_date", unique = true, nullable = false, updatable = false)
    private LocalDate date;

    @Column(name = "name", nullable = false, length = MAX_NAME_LENGTH)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "holiday_type", nullable = false, length = 24)
    private HolidayType type;

    protected Holiday() {}

    public Holiday(LocalDate date, String name, HolidayType type) {
        this.date = date;
        reclassify(name, type);
    }

    /**
     * Changes the name and class of an existing holiday. A blank name falls back to the class's
     * default name.
     */
    public void reclassify(String name, HolidayType type) {
        this.type = type == null ? HolidayType.REGULAR : type;
        this.name = name == null || name.isBlank() ? this.type.getDefaultName() : name.trim();
    }

    public Long getId() { return id; }
    public LocalDate getDate() { return date; }
    public String getName() { return name; }
    public HolidayType getType() { return type; }
}
