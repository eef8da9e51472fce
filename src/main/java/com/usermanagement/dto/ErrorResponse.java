package com.usermanagement.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Error body returned for every failed request.
 * Only {@code error} is always present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response")
public class ErrorResponse {
    /**
     * Short error title
     */
    @Schema(description = "Error title", example = "User Not Found")
    private String error;

    /**
     * Human readable detail
     */
    @Schema(description = "Error detail")
    private String detail;

    /**
     * Validation messages keyed by request field
     */
    @Schema(description = "Validation messages per field")
    private Map<String, List<String>> errors;

    public static ErrorResponse of(String error) {
        return ErrorResponse.builder()
                .error(error)
                .build();
    }

    public static ErrorResponse of(String error, String detail) {
        return ErrorResponse.builder()
                .error(error)
                .detail(detail)
                .build();
    }
}
