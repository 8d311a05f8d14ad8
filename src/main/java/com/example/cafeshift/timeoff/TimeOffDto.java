package com.example.cafeshift.timeoff;

import com.example.cafeshift.timeoff.TimeOffRequest.TimeOffStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record TimeOffDto(Long id,
                         Long employeeId,
                         LocalDate startDate,
                         LocalDate endDate,
                         TimeOffType type,
                         String reason,
                         TimeOffStatus status,
                         LocalDateTime requestedAt,
                         LocalDateTime resolvedAt,
                         Long resolvedBy) {

    public static TimeOffDto from(TimeOffRequest request) {
        return new TimeOffDto(
                request.getId(),
                request.getEmployee().getId(),
                request.getStartDate(),
                request.getEndDate(),
                request.getType(),
                request.getReason(),
                request.getStatus(),
                request.getRequestedAt(),
                request.getResolvedAt(),
                request.getResolvedBy());
    }
}
