package com.example.cafeshift.payroll;

import com.example.cafeshift.common.ApiResponse;
import com.example.cafeshift.common.RequestContext;
import com.example.cafeshift.exception.NotFoundException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/payroll")
public class PayrollController {

    private final PayrollService payrollService;
    private final PayrollJobStatusService jobStatusService;

    public PayrollController(PayrollService payrollService, PayrollJobStatusService jobStatusService) {
        this.payrollService = payrollService;
        this.jobStatusService = jobStatusService;
    }

    @PostMapping("/periods")
    public ResponseEntity<ApiResponse<PayrollPeriodDto>> createPeriod(RequestContext context, @Valid @RequestBody PeriodRequest request) {
        PayrollPeriod period = payrollService.createPeriod(context, request.branchId(), request.startDate(), request.endDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Payroll period created", PayrollPeriodDto.from(period)));
    }

    @GetMapping("/periods")
    public ResponseEntity<ApiResponse<List<PayrollPeriodDto>>> listPeriods(@RequestParam Long branchId) {
        return ResponseEntity.ok(ApiResponse.success(payrollService.listPeriods(branchId)));
    }

    @GetMapping("/periods/{periodId}")
    public ResponseEntity<ApiResponse<PayrollPeriodDto>> getPeriod(@PathVariable Long periodId) {
        return ResponseEntity.ok(ApiResponse.success(payrollService.getPeriod(periodId)));
    }

    @PutMapping("/periods/{periodId}/close")
    public ResponseEntity<ApiResponse<PayrollPeriodDto>> closePeriod(RequestContext context, @PathVariable Long periodId) {
        return ResponseEntity.ok(ApiResponse.success("Payroll period closed",
                PayrollPeriodDto.from(payrollService.closePeriod(context, periodId))));
    }

    @PutMapping("/periods/{periodId}/paid")
    public ResponseEntity<ApiResponse<PayrollPeriodDto>> markPeriodPaid(RequestContext context, @PathVariable Long periodId) {
        return ResponseEntity.ok(ApiResponse.success("Payroll period paid",
                PayrollPeriodDto.from(payrollService.markPeriodPaid(context, periodId))));
    }

    @PostMapping("/periods/{periodId}/run")
    public ResponseEntity<ApiResponse<PayrollRunResult>> run(RequestContext context, @PathVariable Long periodId) {
        PayrollRunResult result = payrollService.runPayroll(context, periodId);
        Map<String, Object> meta = new HashMap<>();
        meta.put("entries", result.entries().size());
        meta.put("errors", result.errors().size());
        return ResponseEntity.ok(ApiResponse.success("Payroll computed", result, meta));
    }

    @PostMapping("/periods/{periodId}/run/async")
    public ResponseEntity<ApiResponse<Map<String, Object>>> runAsync(RequestContext context, @PathVariable Long periodId) {
        context.requireManager("run payroll");
        String jobId = jobStatusService.register(periodId);
        payrollService.runPayrollAsync(context, periodId, jobId);
        Map<String, Object> data = new HashMap<>();
        data.put("jobId", jobId);
        data.put("periodId", periodId);
        return ResponseEntity.accepted().body(ApiResponse.success("Payroll run started", data));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<ApiResponse<PayrollJobStatusService.Status>> job(@PathVariable String jobId) {
        PayrollJobStatusService.Status status = jobStatusService.get(jobId);
        if (status == null) {
            throw new NotFoundException("Payroll job", jobId);
        }
        return ResponseEntity.ok(ApiResponse.success(status));
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<ApiResponse<Map<String, Object>>> cancel(RequestContext context, @PathVariable String jobId) {
        boolean requested = payrollService.cancelPayrollRun(context, jobId);
        return ResponseEntity.ok(ApiResponse.success(requested ? "Cancellation requested" : "Job is not running",
                Map.of("jobId", jobId, "cancelRequested", requested)));
    }

    @GetMapping("/periods/{periodId}/entries")
    public ResponseEntity<ApiResponse<List<PayrollEntryDto>>> entries(@PathVariable Long periodId) {
        return ResponseEntity.ok(ApiResponse.success(payrollService.listEntries(periodId)));
    }

    @GetMapping("/periods/{periodId}/entries/{employeeId}")
    public ResponseEntity<ApiResponse<PayrollEntryDto>> entry(@PathVariable Long periodId, @PathVariable Long employeeId) {
        PayrollEntryDto entry = payrollService.getPayrollEntry(employeeId, periodId)
                .orElseThrow(() -> new NotFoundException("Payroll entry for employee " + employeeId + " in period", periodId));
        return ResponseEntity.ok(ApiResponse.success(entry));
    }

    @PutMapping("/entries/{entryId}/approve")
    public ResponseEntity<ApiResponse<PayrollEntryDto>> approve(RequestContext context, @PathVariable Long entryId) {
        return ResponseEntity.ok(ApiResponse.success("Payroll entry approved", payrollService.approveEntry(context, entryId)));
    }

    @PutMapping("/entries/{entryId}/paid")
    public ResponseEntity<ApiResponse<PayrollEntryDto>> markPaid(RequestContext context, @PathVariable Long entryId) {
        return ResponseEntity.ok(ApiResponse.success("Payroll entry paid", payrollService.markEntryPaid(context, entryId)));
    }

    public record PeriodRequest(@NotNull Long branchId, @NotNull LocalDate startDate, @NotNull LocalDate endDate) {}
}
