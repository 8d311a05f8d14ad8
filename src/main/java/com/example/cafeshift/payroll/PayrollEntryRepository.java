package com.example.cafeshift.payroll;

import com.example.cafeshift.exception.NotFoundException;
import com.example.cafeshift.payroll.PayrollEntry.EntryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PayrollEntryRepository extends JpaRepository<PayrollEntry, Long> {

    default PayrollEntry getRequired(Long id) {
        return findById(id).orElseThrow(() -> new NotFoundException("Payroll entry", id));
    }

    Optional<PayrollEntry> findByEmployee_IdAndPeriod_Id(Long employeeId, Long periodId);

    List<PayrollEntry> findByPeriod_IdOrderByEmployee_IdAsc(Long periodId);

    long countByPeriod_IdAndStatus(Long periodId, EntryStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PayrollEntry e SET e.status = :target WHERE e.id = :id AND e.status = :expected")
    int transition(@Param("id") Long id,
                   @Param("expected") EntryStatus expected,
                   @Param("target") EntryStatus target);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PayrollEntry e SET e.status = :target WHERE e.period.id = :periodId AND e.status = :expected")
    int transitionAll(@Param("periodId") Long periodId,
                      @Param("expected") EntryStatus expected,
                      @Param("target") EntryStatus target);
}
