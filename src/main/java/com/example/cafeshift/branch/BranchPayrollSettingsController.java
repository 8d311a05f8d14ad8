package com.example.cafeshift.branch;

import com.example.cafeshift.common.ApiResponse;
import com.example.cafeshift.common.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.*;

import java.time.DayOfWeek;

@RestController
@RequestMapping("/api/branches/{branchId}/payroll-settings")
public class BranchPayrollSettingsController {

    private static final Logger logger = LoggerFactory.getLogger(BranchPayrollSettingsController.class);

    private final BranchPayrollSettingsRepository repository;

    public BranchPayrollSettingsController(BranchPayrollSettingsRepository repository) {
        this.repository = repository;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<SettingsDto>> get(@PathVariable Long branchId) {
        return ResponseEntity.ok(ApiResponse.success(SettingsDto.from(repository.findOrDefault(branchId))));
    }

    @PutMapping
    @Transactional
    public ResponseEntity<ApiResponse<SettingsDto>> update(RequestContext context, @PathVariable Long branchId,
                                                           @RequestBody SettingsDto request) {
        context.requireManager("change payroll settings");
        BranchPayrollSettings settings = repository.findByBranchId(branchId)
                .orElseGet(() -> new BranchPayrollSettings(branchId));
        if (request.restDay() != null) settings.setRestDay(request.restDay());
        if (request.deductSss() != null) settings.setDeductSss(request.deductSss());
        if (request.deductPhilHealth() != null) settings.setDeductPhilHealth(request.deductPhilHealth());
        if (request.deductPagibig() != null) settings.setDeductPagibig(request.deductPagibig());
        if (request.deductWithholdingTax() != null) settings.setDeductWithholdingTax(request.deductWithholdingTax());
        BranchPayrollSettings saved = repository.save(settings);
        logger.info("Payroll settings updated for branch {}", branchId);
        return ResponseEntity.ok(ApiResponse.success("Payroll settings updated", SettingsDto.from(saved)));
    }

    public record SettingsDto(DayOfWeek restDay, Boolean deductSss, Boolean deductPhilHealth,
                              Boolean deductPagibig, Boolean deductWithholdingTax) {
        static SettingsDto from(BranchPayrollSettings s) {
            return new SettingsDto(s.getRestDay(), s.getDeductSss(), s.getDeductPhilHealth(),
                    s.getDeductPagibig(), s.getDeductWithholdingTax());
        }
    }
}
