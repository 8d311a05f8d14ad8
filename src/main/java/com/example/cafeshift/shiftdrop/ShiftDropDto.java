package com.example.cafeshift.shiftdrop;

import com.example.cafeshift.common.Urgency;
import com.example.cafeshift.shiftdrop.ShiftDropRequest.DropStatus;

import java.time.LocalDateTime;

public record ShiftDropDto(Long id,
                           Long shiftId,
                           LocalDateTime shiftStart,
                           LocalDateTime shiftEnd,
                           Long employeeId,
                           String reason,
                           Urgency urgency,
                           DropStatus status,
                           LocalDateTime requestedAt,
                           Long resolvedBy,
                           LocalDateTime resolvedAt,
                           String managerNotes,
                           Long pickedUpBy,
                           LocalDateTime pickedUpAt) {

    public static ShiftDropDto from(ShiftDropRequest drop) {
        return new ShiftDropDto(
                drop.getId(),
                drop.getShift().getId(),
                drop.getShift().getScheduledStart(),
                drop.getShift().getScheduledEnd(),
                drop.getEmployee().getId(),
                drop.getReason(),
                drop.getUrgency(),
                drop.getStatus(),
                drop.getRequestedAt(),
                drop.getResolvedBy(),
                drop.getResolvedAt(),
                drop.getManagerNotes(),
                drop.getPickedUpBy(),
                drop.getPickedUpAt());
    }
}
