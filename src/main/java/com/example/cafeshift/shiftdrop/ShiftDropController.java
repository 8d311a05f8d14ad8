package com.example.cafeshift.shiftdrop;

import com.example.cafeshift.common.ApiResponse;
import com.example.cafeshift.common.RequestContext;
import com.example.cafeshift.common.Urgency;
import com.example.cafeshift.shift.ShiftDto;
import com.example.cafeshift.shiftdrop.ShiftDropRequest.DropStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/shift-drops")
public class ShiftDropController {

    private final ShiftDropService dropService;

    public ShiftDropController(ShiftDropService dropService) {
        this.dropService = dropService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ShiftDropDto>> create(RequestContext context, @Valid @RequestBody DropRequest request) {
        ShiftDropRequest drop = dropService.createDrop(context, request.shiftId(), request.reason(), request.urgency());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Drop requested", ShiftDropDto.from(drop)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ShiftDropDto>>> list(@RequestParam(defaultValue = "APPROVED") DropStatus status) {
        return ResponseEntity.ok(ApiResponse.success(dropService.listByStatus(status)));
    }

    @GetMapping("/mine")
    public ResponseEntity<ApiResponse<List<ShiftDropDto>>> mine(RequestContext context) {
        return ResponseEntity.ok(ApiResponse.success(dropService.listOwn(context)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ShiftDropDto>> get(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(dropService.getDrop(id)));
    }

    @PutMapping("/{id}/resolve")
    public ResponseEntity<ApiResponse<ShiftDropDto>> resolve(RequestContext context, @PathVariable Long id,
                                                             @Valid @RequestBody ResolveRequest request) {
        ShiftDropRequest drop = dropService.resolveDrop(context, id, request.decision(), request.managerNotes());
        return ResponseEntity.ok(ApiResponse.success("Drop resolved", ShiftDropDto.from(drop)));
    }

    @PostMapping("/{id}/pickup")
    public ResponseEntity<ApiResponse<ShiftDto>> pickup(RequestContext context, @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Shift picked up", ShiftDto.from(dropService.pickupDrop(context, id))));
    }

    @PostMapping("/{id}/assign")
    public ResponseEntity<ApiResponse<ShiftDto>> assign(RequestContext context, @PathVariable Long id,
                                                        @Valid @RequestBody AssignRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Shift assigned",
                ShiftDto.from(dropService.assignDrop(context, id, request.employeeId()))));
    }

    @PutMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<ShiftDropDto>> cancel(RequestContext context, @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Drop cancelled", ShiftDropDto.from(dropService.cancelDrop(context, id))));
    }

    public record DropRequest(@NotNull Long shiftId, @Size(max = 500) String reason, Urgency urgency) {}

    public record ResolveRequest(@NotNull DropDecision decision, @Size(max = 500) String managerNotes) {}

    public record AssignRequest(@NotNull Long employeeId) {}
}
