package com.example.cafeshift.deduction;

import com.example.cafeshift.common.ApiResponse;
import com.example.cafeshift.common.RequestContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/deduction-brackets")
public class DeductionBracketController {

    private final DeductionBracketCatalog catalog;
    private final DeductionBracketResolver resolver;

    public DeductionBracketController(DeductionBracketCatalog catalog, DeductionBracketResolver resolver) {
        this.catalog = catalog;
        this.resolver = resolver;
    }

    @GetMapping("/{type}")
    public ResponseEntity<ApiResponse<List<TableDto>>> list(@PathVariable DeductionType type) {
        List<TableDto> tables = catalog.schedule(type).versions().stream().map(TableDto::from).toList();
        return ResponseEntity.ok(ApiResponse.success(tables));
    }

    @GetMapping("/{type}/resolve")
    public ResponseEntity<ApiResponse<Map<String, Object>>> resolve(
            @PathVariable DeductionType type,
            @RequestParam BigDecimal salary,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        LocalDate date = asOf == null ? LocalDate.now() : asOf;
        BigDecimal amount = resolver.resolve(type, salary, date);
        return ResponseEntity.ok(ApiResponse.success(Map.of("type", type, "salary", salary, "asOf", date, "amount", amount)));
    }

    @PutMapping("/{type}")
    public ResponseEntity<ApiResponse<TableDto>> replace(RequestContext context, @PathVariable DeductionType type,
                                                         @Valid @RequestBody ReplaceRequest request) {
        context.requireManager("change deduction brackets");
        DeductionBracketTable table = catalog.replaceTable(type, request.effectiveFrom(), request.brackets());
        return ResponseEntity.ok(ApiResponse.success("Bracket table replaced", TableDto.from(table)));
    }

    public record ReplaceRequest(@NotNull LocalDate effectiveFrom, @NotEmpty List<DeductionBracketTable.Row> brackets) {}

    public record TableDto(DeductionType type, LocalDate effectiveFrom, List<DeductionBracketTable.Row> brackets) {
        static TableDto from(DeductionBracketTable table) {
            return new TableDto(table.getType(), table.getEffectiveFrom(), table.getRows());
        }
    }
}
