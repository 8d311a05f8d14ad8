package com.example.cafeshift.shift;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;

public interface TimeEntryRepository extends JpaRepository<TimeEntry, Long> {

    List<TimeEntry> findByShiftIdOrderByOccurredAtAsc(Long shiftId);

    List<TimeEntry> findByEmployeeIdAndOccurredAtBetweenOrderByOccurredAtAsc(Long employeeId, LocalDateTime start, LocalDateTime end);
}
