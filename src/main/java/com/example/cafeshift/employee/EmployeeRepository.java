package com.example.cafeshift.employee;

import com.example.cafeshift.exception.NotFoundException;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface EmployeeRepository extends JpaRepository<Employee, Long> {

    List<Employee> findByBranchIdAndActiveTrueOrderByIdAsc(Long branchId);

    default Employee getRequired(Long id) {
        return findById(id).orElseThrow(() -> new NotFoundException("Employee", id));
    }
}
