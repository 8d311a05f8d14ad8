package com.example.cafeshift.holiday;

import com.example.cafeshift.common.ApiResponse;
import com.example.cafeshift.common.RequestContext;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/holidays")
public class HolidayController {

    private final HolidayService holidayService;

    public HolidayController(HolidayService holidayService) {
        this.holidayService = holidayService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<HolidayDto>>> list(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        List<HolidayDto> holidays = holidayService.listBetween(start, end).stream()
                .map(HolidayDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(holidays));
    }

    @PutMapping("/{date}")
    public ResponseEntity<ApiResponse<HolidayDto>> upsert(RequestContext context,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestBody HolidayRequest request) {
        Holiday saved = holidayService.upsert(context, date, request.name(), request.type());
        return ResponseEntity.ok(ApiResponse.success("Holiday saved", HolidayDto.from(saved)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(RequestContext context, @PathVariable Long id) {
        holidayService.delete(context, id);
        return ResponseEntity.ok(ApiResponse.success("Holiday deleted", null));
    }

    public record HolidayRequest(String name, HolidayType type) {}

    public record HolidayDto(Long id, LocalDate date, String name, HolidayType type) {
        static HolidayDto from(Holiday holiday) {
            return new HolidayDto(holiday.getId(), holiday.getDate(), holiday.getName(), holiday.getType());
        }
    }
}
