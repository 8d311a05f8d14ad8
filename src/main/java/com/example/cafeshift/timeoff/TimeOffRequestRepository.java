package com.example.cafeshift.timeoff;

import com.example.cafeshift.exception.NotFoundException;
import com.example.cafeshift.timeoff.TimeOffRequest.TimeOffStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface TimeOffRequestRepository extends JpaRepository<TimeOffRequest, Long> {

    default TimeOffRequest getRequired(Long id) {
        return findById(id).orElseThrow(() -> new NotFoundException("Time-off request", id));
    }

    List<TimeOffRequest> findByEmployee_IdOrderByStartDateAsc(Long employeeId);

    List<TimeOffRequest> findByStatusOrderByRequestedAtAsc(TimeOffStatus status);

    /**
     * Other requests of the employee in {@code status} sharing at least one day with [start, end].
     */
    @Query("SELECT r FROM TimeOffRequest r WHERE r.employee.id = :employeeId AND r.status = :status " +
           "AND r.id <> :excludeId AND r.startDate <= :end AND r.endDate >= :start ORDER BY r.startDate ASC")
    List<TimeOffRequest> findOverlapping(@Param("employeeId") Long employeeId,
                                         @Param("status") TimeOffStatus status,
                                         @Param("start") LocalDate start,
                                         @Param("end") LocalDate end,
                                         @Param("excludeId") Long excludeId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TimeOffRequest r SET r.status = :target, r.resolvedAt = :now, r.resolvedBy = :managerId " +
           "WHERE r.id = :id AND r.status = :expected")
    int transition(@Param("id") Long id,
                   @Param("expected") TimeOffStatus expected,
                   @Param("target") TimeOffStatus target,
                   @Param("managerId") Long managerId,
                   @Param("now") LocalDateTime now);
}
