package com.example.cafeshift.shifttrade;

import com.example.cafeshift.exception.NotFoundException;
import com.example.cafeshift.shifttrade.ShiftTradeRequest.TradeStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ShiftTradeRequestRepository extends JpaRepository<ShiftTradeRequest, Long> {

    default ShiftTradeRequest getRequired(Long id) {
        return findById(id).orElseThrow(() -> new NotFoundException("Shift trade", id));
    }

    boolean existsByShift_IdAndStatus(Long shiftId, TradeStatus status);

    /**
     * Trades in {@code status} the given employee could claim: open ones plus those addressed to them.
     */
    @Query("SELECT t FROM ShiftTradeRequest t JOIN FETCH t.shift s " +
           "WHERE t.status = :status " +
           "AND t.fromEmployee.id <> :employeeId " +
           "AND (t.toEmployee IS NULL OR t.toEmployee.id = :employeeId) " +
           "ORDER BY s.scheduledStart ASC")
    List<ShiftTradeRequest> findClaimableBy(@Param("employeeId") Long employeeId, @Param("status") TradeStatus status);

    List<ShiftTradeRequest> findByFromEmployee_IdOrderByRequestedAtDesc(Long employeeId);

    /**
     * Moves a trade out of {@code expected}. Returns 0 when another caller got there first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ShiftTradeRequest t SET t.status = :target, t.resolvedAt = :now, t.resolvedBy = :actorId " +
           "WHERE t.id = :id AND t.status = :expected")
    int transition(@Param("id") Long id,
                   @Param("expected") TradeStatus expected,
                   @Param("target") TradeStatus target,
                   @Param("actorId") Long actorId,
                   @Param("now") LocalDateTime now);
}
