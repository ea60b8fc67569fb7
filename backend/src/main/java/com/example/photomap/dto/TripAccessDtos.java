package com.example.photomap.dto;

import com.example.photomap.access.EffectiveRole;
import com.example.photomap.model.TripAccess;
import com.example.photomap.model.TripRole;
import com.example.photomap.model.UserProfile;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.time.Instant;
import java.util.List;

public final class TripAccessDtos {

    private TripAccessDtos() {
    }

    public record GrantAccessRequest(
            @NotBlank @Pattern(regexp = InviteDtos.UUID_PATTERN, message = "Invalid user ID format") String userId,
            @NotBlank @Pattern(regexp = InviteDtos.UUID_PATTERN, message = "Invalid trip ID format") String tripId,
            @NotBlank @Pattern(regexp = TripRole.PATTERN, message = "Role must be either 'editor' or 'viewer'") String role
    ) { }

    public record UpdateRoleRequest(
            @NotBlank @Pattern(regexp = TripRole.PATTERN, message = "Role must be either 'editor' or 'viewer'") String role
    ) { }

    public record TripAccessView(String id, String userId, String tripId, TripRole role, Instant grantedAt,
                                 String grantedByUserId) {
        public static TripAccessView from(TripAccess access) {
            return new TripAccessView(access.getId(), access.getUserId(), access.getTripId(), access.getRole(),
                    access.getGrantedAt(), access.getGrantedByUserId());
        }
    }

    public record TripAccessResponse(TripAccessView tripAccess) { }

    public record TripAccessUser(String id, String userId, String email, String displayName, TripRole role,
                                 Instant grantedAt, String grantedByUserId) {
        public static TripAccessUser from(TripAccess access, UserProfile user) {
            return new TripAccessUser(access.getId(), user.getId(), user.getEmail(), user.getDisplayName(),
                    access.getRole(), access.getGrantedAt(), access.getGrantedByUserId());
        }
    }

    public record TripAccessUsersResponse(List<TripAccessUser> users) { }

    public record UserSummary(String id, String email, String displayName, @JsonProperty("isAdmin") boolean isAdmin) {
        public static UserSummary from(UserProfile user) {
            return new UserSummary(user.getId(), user.getEmail(), user.getDisplayName(), user.isAdmin());
        }
    }

    public record UsersResponse(List<UserSummary> users) { }

    public record TripRoleResponse(String tripId, EffectiveRole role) { }

    public record RevokeAccessResponse(boolean success, String message) { }
}
