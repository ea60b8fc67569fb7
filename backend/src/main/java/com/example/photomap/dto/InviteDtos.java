package com.example.photomap.dto;

import com.example.photomap.model.Invite;
import com.example.photomap.model.InviteStatus;
import com.example.photomap.model.Trip;
import com.example.photomap.model.TripRole;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;

import java.time.Instant;
import java.util.List;

public final class InviteDtos {

    public static final String UUID_PATTERN =
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";

    private InviteDtos() {
    }

    public record CreateInviteRequest(
            @NotBlank @Email(message = "Invalid email format") String email,
            @NotBlank @Pattern(regexp = TripRole.PATTERN, message = "Role must be either 'editor' or 'viewer'") String role,
            @NotEmpty(message = "At least one trip is required")
            List<@Pattern(regexp = UUID_PATTERN, message = "Invalid trip ID format") String> tripIds
    ) { }

    public record InviteView(
            String id,
            String code,
            String email,
            TripRole role,
            Instant expiresAt,
            Instant usedAt,
            String usedByUserId,
            Instant revokedAt,
            Instant createdAt
    ) {
        public static InviteView from(Invite invite) {
            return new InviteView(invite.getId(), invite.getCode(), invite.getEmail(), invite.getRole(),
                    invite.getExpiresAt(), invite.getUsedAt(), invite.getUsedByUserId(), invite.getRevokedAt(),
                    invite.getCreatedAt());
        }
    }

    public record CreateInviteResponse(InviteView invite, List<String> tripIds) { }

    public record InviteListItem(
            String id,
            String code,
            String email,
            TripRole role,
            Instant expiresAt,
            Instant usedAt,
            String usedByUserId,
            Instant createdAt,
            int tripCount,
            InviteStatus status
    ) {
        public static InviteListItem from(Invite invite, InviteStatus status) {
            return new InviteListItem(invite.getId(), invite.getCode(), invite.getEmail(), invite.getRole(),
                    invite.getExpiresAt(), invite.getUsedAt(), invite.getUsedByUserId(), invite.getCreatedAt(),
                    invite.getTripIds() == null ? 0 : invite.getTripIds().size(), status);
        }
    }

    public record InviteListResponse(List<InviteListItem> invites) { }

    public record InviteSummary(String email, TripRole role, Instant expiresAt) { }

    public record TripSummary(String id, String title, String slug) {
        public static TripSummary from(Trip trip) {
            return new TripSummary(trip.getId(), trip.getTitle(), trip.getSlug());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record InviteValidationResponse(boolean valid, InviteSummary invite, List<TripSummary> trips, String message) {

        public static InviteValidationResponse invalid() {
            return new InviteValidationResponse(false, null, null, "Invalid or expired invite");
        }
    }

    public record RevokeInviteResponse(boolean success, String message) { }
}
