package com.example.cafeshift.common;

import com.example.cafeshift.common.error.ErrorLogBuffer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/admin/errors")
public class ErrorLogController {

    private final ErrorLogBuffer errorLogBuffer;

    public ErrorLogController(ErrorLogBuffer errorLogBuffer) {
        this.errorLogBuffer = errorLogBuffer;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ErrorLogBuffer.Entry>>> recent() {
        return ResponseEntity.ok(ApiResponse.success(errorLogBuffer.recent()));
    }

    @DeleteMapping
    public ResponseEntity<ApiResponse<Void>> clear() {
        errorLogBuffer.clear();
        return ResponseEntity.ok(ApiResponse.success("Error log cleared", null));
    }
}
