package com.example.cafeshift.shift;

import com.example.cafeshift.breaks.BreakType;

import java.time.LocalDateTime;
import java.util.List;

public record ShiftDto(Long id,
                       Long employeeId,
                       Long branchId,
                       LocalDateTime scheduledStart,
                       LocalDateTime scheduledEnd,
                       LocalDateTime actualStart,
                       LocalDateTime actualEnd,
                       String position,
                       ShiftStatus status,
                       List<BreakDto> breaks) {

    public static ShiftDto from(Shift shift) {
        return new ShiftDto(
                shift.getId(),
                shift.getEmployee().getId(),
                shift.getBranchId(),
                shift.getScheduledStart(),
                shift.getScheduledEnd(),
                shift.getActualStart(),
                shift.getActualEnd(),
                shift.getPosition(),
                shift.getStatus(),
                shift.getBreaks().stream().map(BreakDto::from).toList());
    }

    public record BreakDto(Long id, BreakType type, LocalDateTime scheduledStart, LocalDateTime scheduledEnd,
                           LocalDateTime actualStart, LocalDateTime actualEnd, boolean paid, boolean required) {
        static BreakDto from(ShiftBreak b) {
            return new BreakDto(b.getId(), b.getType(), b.getScheduledStart(), b.getScheduledEnd(),
                    b.getActualStart(), b.getActualEnd(), b.isPaid(), b.isRequired());
        }
    }
}
