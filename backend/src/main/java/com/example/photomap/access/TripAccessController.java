package com.example.photomap.access;

import com.example.photomap.dto.InviteDtos;
import com.example.photomap.dto.TripAccessDtos.GrantAccessRequest;
import com.example.photomap.dto.TripAccessDtos.RevokeAccessResponse;
import com.example.photomap.dto.TripAccessDtos.TripAccessResponse;
import com.example.photomap.dto.TripAccessDtos.TripAccessUser;
import com.example.photomap.dto.TripAccessDtos.TripAccessUsersResponse;
import com.example.photomap.dto.TripAccessDtos.TripAccessView;
import com.example.photomap.dto.TripAccessDtos.TripRoleResponse;
import com.example.photomap.dto.TripAccessDtos.UpdateRoleRequest;
import com.example.photomap.dto.TripAccessDtos.UserSummary;
import com.example.photomap.dto.TripAccessDtos.UsersResponse;
import com.example.photomap.exceptions.PhotoMapException;
import com.example.photomap.model.TripRole;
import com.example.photomap.repo.TripRepository;
import com.example.photomap.security.AuthenticatedUser;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class TripAccessController {

    private final TripAccessService tripAccessService;
    private final TripAccessGate tripAccessGate;
    private final TripRepository trips;

    public TripAccessController(TripAccessService tripAccessService, TripAccessGate tripAccessGate,
                                TripRepository trips) {
        this.tripAccessService = tripAccessService;
        this.tripAccessGate = tripAccessGate;
        this.trips = trips;
    }

    @PostMapping("/trip-access")
    public ResponseEntity<TripAccessResponse> grant(@AuthenticationPrincipal AuthenticatedUser admin,
                                                    @Valid @RequestBody GrantAccessRequest request) {
        var access = tripAccessService.grant(admin.id(), request.userId(), request.tripId(),
                TripRole.fromValue(request.role()));
        return ResponseEntity.status(HttpStatus.CREATED).body(new TripAccessResponse(TripAccessView.from(access)));
    }

    @GetMapping("/trips/{tripId}/access")
    public TripAccessUsersResponse listForTrip(@PathVariable String tripId) {
        requireUuid(tripId, "Invalid trip ID format");
        return new TripAccessUsersResponse(tripAccessService.listForTrip(tripId).stream()
                .map(granted -> TripAccessUser.from(granted.access(), granted.user()))
                .toList());
    }

    @PatchMapping("/trip-access/{id}")
    public TripAccessResponse updateRole(@AuthenticationPrincipal AuthenticatedUser admin,
                                         @PathVariable String id,
                                         @Valid @RequestBody UpdateRoleRequest request) {
        requireUuid(id, "Invalid access ID format");
        return new TripAccessResponse(TripAccessView.from(
                tripAccessService.updateRole(admin.id(), id, TripRole.fromValue(request.role()))));
    }

    @DeleteMapping("/trip-access/{id}")
    public RevokeAccessResponse revoke(@AuthenticationPrincipal AuthenticatedUser admin, @PathVariable String id) {
        requireUuid(id, "Invalid access ID format");
        tripAccessService.revoke(admin.id(), id);
        return new RevokeAccessResponse(true, "Trip access revoked");
    }

    @GetMapping("/users")
    public UsersResponse users() {
        return new UsersResponse(tripAccessService.listUsers().stream().map(UserSummary::from).toList());
    }

    @GetMapping("/trips/{tripId}/role")
    public TripRoleResponse role(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable String tripId) {
        requireUuid(tripId, "Invalid trip ID format");
        EffectiveRole role = tripAccessGate.resolve(user, tripId);
        if (role == EffectiveRole.ADMIN && !trips.existsById(tripId)) {
            throw PhotoMapException.notFound("Trip not found").get();
        }
        return new TripRoleResponse(tripId, role);
    }

    private void requireUuid(String value, String message) {
        if (value == null || !value.matches(InviteDtos.UUID_PATTERN)) {
            throw new PhotoMapException(PhotoMapException.Errors.VALIDATION_FAILED, message);
        }
    }
}
