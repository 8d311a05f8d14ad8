package com.example.cafeshift.shiftdrop;

import com.example.cafeshift.exception.NotFoundException;
import com.example.cafeshift.shiftdrop.ShiftDropRequest.DropStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface ShiftDropRequestRepository extends JpaRepository<ShiftDropRequest, Long> {

    default ShiftDropRequest getRequired(Long id) {
        return findById(id).orElseThrow(() -> new NotFoundException("Shift drop", id));
    }

    boolean existsByShift_IdAndStatusIn(Long shiftId, Collection<DropStatus> statuses);

    List<ShiftDropRequest> findByStatusOrderByRequestedAtAsc(DropStatus status);

    List<ShiftDropRequest> findByEmployee_IdOrderByRequestedAtDesc(Long employeeId);

    /**
     * Manager decision on a pending drop.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ShiftDropRequest d SET d.status = :target, d.resolvedBy = :managerId, d.resolvedAt = :now, " +
           "d.managerNotes = :notes WHERE d.id = :id AND d.status = :expected")
    int resolve(@Param("id") Long id,
                @Param("expected") DropStatus expected,
                @Param("target") DropStatus target,
                @Param("managerId") Long managerId,
                @Param("notes") String notes,
                @Param("now") LocalDateTime now);

    /**
     * Moves an approved drop to picked up for {@code employeeId}; exactly one caller can match.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ShiftDropRequest d SET d.status = :target, d.pickedUpBy = :employeeId, d.pickedUpAt = :now " +
           "WHERE d.id = :id AND d.status = :expected")
    int pickUp(@Param("id") Long id,
               @Param("expected") DropStatus expected,
               @Param("target") DropStatus target,
               @Param("employeeId") Long employeeId,
               @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ShiftDropRequest d SET d.status = :target, d.resolvedBy = :actorId, d.resolvedAt = :now " +
           "WHERE d.id = :id AND d.status IN :cancellable")
    int cancel(@Param("id") Long id,
               @Param("cancellable") Collection<DropStatus> cancellable,
               @Param("target") DropStatus target,
               @Param("actorId") Long actorId,
               @Param("now") LocalDateTime now);
}
