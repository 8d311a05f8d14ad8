package com.example.cafeshift.shifttrade;

import com.example.cafeshift.common.ApiResponse;
import com.example.cafeshift.common.RequestContext;
import com.example.cafeshift.common.Urgency;
import com.example.cafeshift.shift.ShiftDto;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/shift-trades")
public class ShiftTradeController {

    private final ShiftTradeService tradeService;

    public ShiftTradeController(ShiftTradeService tradeService) {
        this.tradeService = tradeService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ShiftTradeDto>> create(RequestContext context, @Valid @RequestBody TradeRequest request) {
        ShiftTradeRequest trade = tradeService.createTrade(context, request.shiftId(), request.toEmployeeId(),
                request.reason(), request.urgency());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Trade requested", ShiftTradeDto.from(trade)));
    }

    @GetMapping("/claimable")
    public ResponseEntity<ApiResponse<List<ShiftTradeDto>>> claimable(RequestContext context) {
        return ResponseEntity.ok(ApiResponse.success(tradeService.listClaimable(context)));
    }

    @GetMapping("/mine")
    public ResponseEntity<ApiResponse<List<ShiftTradeDto>>> mine(RequestContext context) {
        return ResponseEntity.ok(ApiResponse.success(tradeService.listOwn(context)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ShiftTradeDto>> get(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(tradeService.getTrade(id)));
    }

    @PostMapping("/{id}/claim")
    public ResponseEntity<ApiResponse<ShiftDto>> claim(RequestContext context, @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Shift claimed", ShiftDto.from(tradeService.claimTrade(context, id))));
    }

    @PutMapping("/{id}/reject")
    public ResponseEntity<ApiResponse<ShiftTradeDto>> reject(RequestContext context, @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Trade rejected", ShiftTradeDto.from(tradeService.rejectTrade(context, id))));
    }

    @PutMapping("/{id}/withdraw")
    public ResponseEntity<ApiResponse<ShiftTradeDto>> withdraw(RequestContext context, @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Trade withdrawn", ShiftTradeDto.from(tradeService.withdrawTrade(context, id))));
    }

    public record TradeRequest(@NotNull Long shiftId, Long toEmployeeId, @Size(max = 500) String reason, Urgency urgency) {}
}
