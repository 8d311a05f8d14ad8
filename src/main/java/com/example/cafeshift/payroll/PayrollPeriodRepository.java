package com.example.cafeshift.payroll;

import com.example.cafeshift.exception.NotFoundException;
import com.example.cafeshift.payroll.PayrollPeriod.PeriodStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PayrollPeriodRepository extends JpaRepository<PayrollPeriod, Long> {

    default PayrollPeriod getRequired(Long id) {
        return findById(id).orElseThrow(() -> new NotFoundException("Payroll period", id));
    }

    boolean existsByBranchIdAndStatus(Long branchId, PeriodStatus status);

    Optional<PayrollPeriod> findFirstByBranchIdAndStatus(Long branchId, PeriodStatus status);

    List<PayrollPeriod> findByBranchIdOrderByStartDateDesc(Long branchId);
}
