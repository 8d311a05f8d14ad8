package com.example.cafeshift.shift;

import com.example.cafeshift.employee.Employee;
import com.example.cafeshift.exception.NotFoundException;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ShiftRepository extends JpaRepository<Shift, Long> {

    default Shift getRequired(Long id) {
        return findById(id).orElseThrow(() -> new NotFoundException("Shift", id));
    }

    /**
     * Row-locks the shift until the surrounding transaction ends. Requests that must not coexist
     * on one shift (pending trades, active drops) are created under this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Shift s WHERE s.id = :id")
    Optional<Shift> findByIdForUpdate(@Param("id") Long id);

    default Shift getRequiredForUpdate(Long id) {
        return findByIdForUpdate(id).orElseThrow(() -> new NotFoundException("Shift", id));
    }

    /**
     * Completed shifts of an employee whose clock-in falls inside the window, breaks fetched.
     */
    @Query("SELECT DISTINCT s FROM Shift s LEFT JOIN FETCH s.breaks " +
           "WHERE s.employee.id = :employeeId AND s.status = com.example.cafeshift.shift.ShiftStatus.COMPLETED " +
           "AND s.actualStart IS NOT NULL AND s.actualEnd IS NOT NULL " +
           "AND s.actualStart >= :from AND s.actualStart < :to " +
           "ORDER BY s.actualStart ASC")
    List<Shift> findCompletedForEmployee(@Param("employeeId") Long employeeId,
                                         @Param("from") LocalDateTime from,
                                         @Param("to") LocalDateTime to);

    List<Shift> findByEmployee_IdAndScheduledStartBetweenOrderByScheduledStartAsc(Long employeeId, LocalDateTime from, LocalDateTime to);

    /**
     * Moves a shift to a new owner only if the expected owner still holds it.
     *
     * @return number of updated rows, 0 when someone else changed the shift first
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Shift s SET s.employee = :newOwner, s.version = s.version + 1, s.updatedAt = :now " +
           "WHERE s.id = :shiftId AND s.employee.id = :expectedOwnerId " +
           "AND s.status = com.example.cafeshift.shift.ShiftStatus.SCHEDULED")
    int reassign(@Param("shiftId") Long shiftId,
                 @Param("expectedOwnerId") Long expectedOwnerId,
                 @Param("newOwner") Employee newOwner,
                 @Param("now") LocalDateTime now);
}
