package com.example.cafeshift.deduction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface DeductionBracketRepository extends JpaRepository<DeductionBracket, Long> {

    List<DeductionBracket> findByTypeAndActiveTrueOrderByEffectiveFromAscMinSalaryAsc(DeductionType type);

    long countByType(DeductionType type);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM DeductionBracket b WHERE b.type = :type AND b.effectiveFrom = :effectiveFrom")
    int deleteVersion(@Param("type") DeductionType type, @Param("effectiveFrom") LocalDate effectiveFrom);
}
