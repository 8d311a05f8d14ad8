package com.example.cafeshift.shift;

import com.example.cafeshift.breaks.BreakType;
import com.example.cafeshift.common.ApiResponse;
import com.example.cafeshift.common.RequestContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/shifts")
public class ShiftController {

    private final TimeLedgerService timeLedgerService;

    public ShiftController(TimeLedgerService timeLedgerService) {
        this.timeLedgerService = timeLedgerService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ShiftDto>> create(RequestContext context, @Valid @RequestBody CreateShiftRequest request) {
        Shift shift = timeLedgerService.createShift(context, request.employeeId(), request.start(), request.end(), request.position());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Shift created", ShiftDto.from(shift)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ShiftDto>> get(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(ShiftDto.from(timeLedgerService.getShift(id))));
    }

    @GetMapping("/{id}/time-entries")
    public ResponseEntity<ApiResponse<List<TimeEntry>>> timeEntries(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(timeLedgerService.getTimeEntries(id)));
    }

    @PostMapping("/{id}/plan-breaks")
    public ResponseEntity<ApiResponse<ShiftDto>> planBreaks(RequestContext context, @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Breaks planned", ShiftDto.from(timeLedgerService.planBreaks(context, id))));
    }

    @PostMapping("/{id}/breaks")
    public ResponseEntity<ApiResponse<ShiftDto>> addBreak(RequestContext context, @PathVariable Long id,
                                                          @Valid @RequestBody BreakRequest request) {
        Shift shift = timeLedgerService.addBreak(context, id, request.type(), request.start(), request.end(),
                request.paid(), request.required());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Break added", ShiftDto.from(shift)));
    }

    @PostMapping("/{id}/clock-in")
    public ResponseEntity<ApiResponse<ShiftDto>> clockIn(RequestContext context, @PathVariable Long id,
                                                         @RequestBody(required = false) ClockRequest request) {
        Shift shift = timeLedgerService.clockIn(context, id, request == null ? null : request.at());
        return ResponseEntity.ok(ApiResponse.success("Clocked in", ShiftDto.from(shift)));
    }

    @PostMapping("/{id}/clock-out")
    public ResponseEntity<ApiResponse<ShiftDto>> clockOut(RequestContext context, @PathVariable Long id,
                                                          @RequestBody(required = false) ClockRequest request) {
        Shift shift = timeLedgerService.clockOut(context, id, request == null ? null : request.at());
        return ResponseEntity.ok(ApiResponse.success("Clocked out", ShiftDto.from(shift)));
    }

    @PostMapping("/{id}/breaks/{breakId}/start")
    public ResponseEntity<ApiResponse<ShiftDto>> startBreak(RequestContext context, @PathVariable Long id, @PathVariable Long breakId,
                                                            @RequestBody(required = false) ClockRequest request) {
        Shift shift = timeLedgerService.startBreak(context, id, breakId, request == null ? null : request.at());
        return ResponseEntity.ok(ApiResponse.success("Break started", ShiftDto.from(shift)));
    }

    @PostMapping("/{id}/breaks/{breakId}/end")
    public ResponseEntity<ApiResponse<ShiftDto>> endBreak(RequestContext context, @PathVariable Long id, @PathVariable Long breakId,
                                                          @RequestBody(required = false) ClockRequest request) {
        Shift shift = timeLedgerService.endBreak(context, id, breakId, request == null ? null : request.at());
        return ResponseEntity.ok(ApiResponse.success("Break ended", ShiftDto.from(shift)));
    }

    @PutMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<ShiftDto>> cancel(RequestContext context, @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Shift cancelled", ShiftDto.from(timeLedgerService.cancelShift(context, id))));
    }

    public record CreateShiftRequest(@NotNull Long employeeId, @NotNull LocalDateTime start,
                                     @NotNull LocalDateTime end, String position) {}

    public record BreakRequest(@NotNull BreakType type, @NotNull LocalDateTime start, @NotNull LocalDateTime end,
                               boolean paid, boolean required) {}

    public record ClockRequest(LocalDateTime at) {}
}
