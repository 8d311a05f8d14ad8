package com.example.cafeshift.timeoff;

import com.example.cafeshift.common.ApiResponse;
import com.example.cafeshift.common.RequestContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/time-off")
public class TimeOffController {

    private final TimeOffService timeOffService;

    public TimeOffController(TimeOffService timeOffService) {
        this.timeOffService = timeOffService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<TimeOffDto>> request(RequestContext context, @Valid @RequestBody TimeOffBody body) {
        Long employeeId = body.employeeId() == null ? context.actorId() : body.employeeId();
        TimeOffRequest request = timeOffService.requestTimeOff(context, employeeId, body.startDate(), body.endDate(),
                body.type(), body.reason());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Time off requested", TimeOffDto.from(request)));
    }

    @GetMapping("/pending")
    public ResponseEntity<ApiResponse<List<TimeOffDto>>> pending() {
        return ResponseEntity.ok(ApiResponse.success(timeOffService.listPending()));
    }

    @GetMapping("/employee/{employeeId}")
    public ResponseEntity<ApiResponse<List<TimeOffDto>>> forEmployee(@PathVariable Long employeeId) {
        return ResponseEntity.ok(ApiResponse.success(timeOffService.listForEmployee(employeeId)));
    }

    @PutMapping("/{id}/approve")
    public ResponseEntity<ApiResponse<TimeOffDto>> approve(RequestContext context, @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Time off approved", TimeOffDto.from(timeOffService.approveTimeOff(context, id))));
    }

    @PutMapping("/{id}/reject")
    public ResponseEntity<ApiResponse<TimeOffDto>> reject(RequestContext context, @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Time off rejected", TimeOffDto.from(timeOffService.rejectTimeOff(context, id))));
    }

    public record TimeOffBody(Long employeeId, @NotNull LocalDate startDate, @NotNull LocalDate endDate,
                              @NotNull TimeOffType type, @Size(max = 500) String reason) {}
}
