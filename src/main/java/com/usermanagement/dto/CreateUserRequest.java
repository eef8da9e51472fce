package com.usermanagement.dto;

import com.usermanagement.validation.TrimmedSize;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create user request")
public class CreateUserRequest implements UserPayload {
    @NotBlank(message = "Email is required.")
    @Email(message = "Email must be a valid email address.")
    @Schema(description = "Email address", example = "jane.doe@example.com")
    private String email;

    @NotBlank(message = "Full name is required.")
    @TrimmedSize(min = 2, message = "Full name must be at least 2 characters long.")
    @Schema(description = "Full name", example = "Jane Doe")
    private String fullName;

    /**
     * Surrounding whitespace is dropped before validation
     */
    public void setEmail(String email) {
        this.email = UserPayload.trim(email);
    }

    public void setFullName(String fullName) {
        this.fullName = UserPayload.trim(fullName);
    }
}
