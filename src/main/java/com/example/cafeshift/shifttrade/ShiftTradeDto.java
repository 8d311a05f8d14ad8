package com.example.cafeshift.shifttrade;

import com.example.cafeshift.common.Urgency;
import com.example.cafeshift.shifttrade.ShiftTradeRequest.TradeStatus;

import java.time.LocalDateTime;

public record ShiftTradeDto(Long id,
                            Long shiftId,
                            LocalDateTime shiftStart,
                            LocalDateTime shiftEnd,
                            Long fromEmployeeId,
                            Long toEmployeeId,
                            String reason,
                            Urgency urgency,
                            TradeStatus status,
                            LocalDateTime requestedAt,
                            LocalDateTime resolvedAt,
                            Long resolvedBy) {

    public static ShiftTradeDto from(ShiftTradeRequest trade) {
        return new ShiftTradeDto(
                trade.getId(),
                trade.getShift().getId(),
                trade.getShift().getScheduledStart(),
                trade.getShift().getScheduledEnd(),
                trade.getFromEmployee().getId(),
                trade.getToEmployee() == null ? null : trade.getToEmployee().getId(),
                trade.getReason(),
                trade.getUrgency(),
                trade.getStatus(),
                trade.getRequestedAt(),
                trade.getResolvedAt(),
                trade.getResolvedBy());
    }
}
