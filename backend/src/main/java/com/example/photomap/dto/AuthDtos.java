package com.example.photomap.dto;

import com.example.photomap.model.UserProfile;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.time.Instant;

public final class AuthDtos {

    private AuthDtos() {
    }

    public record PublicUser(String id, String email, String displayName, @JsonProperty("isAdmin") boolean isAdmin) {
        public static PublicUser from(UserProfile user) {
            return new PublicUser(user.getId(), user.getEmail(), user.getDisplayName(), user.isAdmin());
        }
    }

    public record AuthResponse(PublicUser user, String token) { }

    public record ProfileResponse(String id, String email, String displayName,
                                  @JsonProperty("isAdmin") boolean isAdmin,
                                  Instant createdAt, Instant updatedAt) {
        public static ProfileResponse from(UserProfile user) {
            return new ProfileResponse(user.getId(), user.getEmail(), user.getDisplayName(), user.isAdmin(),
                    user.getCreatedAt(), user.getUpdatedAt());
        }
    }

    public record RegistrationStatusResponse(boolean registrationOpen, boolean inviteRequired) { }

    public record SuccessResponse(boolean success) { }

    public record RecoveryRequest(
            @NotBlank @Email(message = "Invalid email format") String email
    ) { }

    public record RecoveryVerifyRequest(
            @NotBlank @Email(message = "Invalid email format") String email,
            @NotBlank @Pattern(regexp = "^\\d{6}$", message = "Code must be 6 digits") String code
    ) { }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RecoveryResponse(boolean success, String message, String redirectTo) { }
}
