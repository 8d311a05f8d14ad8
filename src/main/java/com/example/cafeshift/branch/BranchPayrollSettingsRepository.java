package com.example.cafeshift.branch;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface BranchPayrollSettingsRepository extends JpaRepository<BranchPayrollSettings, Long> {

    Optional<BranchPayrollSettings> findByBranchId(Long branchId);

    default BranchPayrollSettings findOrDefault(Long branchId) {
        return findByBranchId(branchId).orElseGet(() -> BranchPayrollSettings.defaults(branchId));
    }
}
