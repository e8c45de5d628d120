package com.weatherbites.dto;

import com.weatherbites.exception.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

// ========== Error Response DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private ErrorKind error;
    private String message;
    private LocalDateTime timestamp;
}
