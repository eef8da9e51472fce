package com.usermanagement.controller;

import com.usermanagement.domain.User;
import com.usermanagement.dto.CreateUserRequest;
import com.usermanagement.dto.ErrorResponse;
import com.usermanagement.dto.UpdateUserRequest;
import com.usermanagement.dto.UserResponse;
import com.usermanagement.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST Controller for User management
 * Handles user listing, query, creation, update and deletion
 */
@Slf4j
@RestController
@RequestMapping("/api/users")
@Tag(name = "Users", description = "APIs for user operations")
@SecurityRequirement(name = "bearerAuth")
public class UserController {

    @Autowired
    private UserService userService;

    /**
     * Get all users
     *
     * @return users ordered by full name, then email
     */
    @GetMapping
    @Operation(summary = "Get all users", description = "Returns all registered users")
    public List<UserResponse> getUsers() {
        log.debug("Listing users");
        return userService.listUsers().stream()
                .map(UserResponse::fromUser)
                .collect(Collectors.toList());
    }

    /**
     * Get user by ID
     *
     * @param userId the user ID
     * @return user details
     */
    @GetMapping("/{userId}")
    @Operation(summary = "Get a user by id", description = "Returns a single user when the identifier exists")
    @ApiResponse(responseCode = "200", description = "User found")
    @ApiResponse(responseCode = "404", description = "User not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public UserResponse getUser(
            @Parameter(description = "User ID", required = true)
            @PathVariable UUID userId) {
        log.debug("Getting user: userId={}", userId);
        return UserResponse.fromUser(userService.getUserById(userId));
    }

    /**
     * Create a new user
     *
     * @param request the create user request
     * @return created user with its location
     */
    @PostMapping
    @Operation(summary = "Create a new user", description = "Registers a new user when the request is valid")
    @ApiResponse(responseCode = "201", description = "User created")
    @ApiResponse(responseCode = "400", description = "Validation failed",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "409", description = "Email already in use",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public ResponseEntity<UserResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        log.info("Creating user: email={}", request.getEmail());
        User user = userService.createUser(request);
        return ResponseEntity.created(URI.create("/api/users/" + user.getId()))
                .body(UserResponse.fromUser(user));
    }

    /**
     * Update user
     *
     * @param userId  the user ID
     * @param request the update user request
     * @return updated user details
     */
    @PutMapping("/{userId}")
    @Operation(summary = "Update an existing user",
            description = "Updates a user when the identifier exists and the payload is valid")
    @ApiResponse(responseCode = "200", description = "User updated")
    @ApiResponse(responseCode = "400", description = "Validation failed",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "404", description = "User not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "409", description = "Email already in use",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public UserResponse updateUser(
            @Parameter(description = "User ID", required = true)
            @PathVariable UUID userId,
            @Valid @RequestBody UpdateUserRequest request) {
        log.info("Updating user: userId={}", userId);
        return UserResponse.fromUser(userService.updateUser(userId, request));
    }

    /**
     * Delete user
     *
     * @param userId the user ID
     */
    @DeleteMapping("/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete a user", description = "Deletes the specified user when it exists")
    @ApiResponse(responseCode = "204", description = "User deleted")
    @ApiResponse(responseCode = "404", description = "User not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public void deleteUser(
            @Parameter(description = "User ID", required = true)
            @PathVariable UUID userId) {
        log.info("Deleting user: userId={}", userId);
        userService.deleteUser(userId);
    }
}
