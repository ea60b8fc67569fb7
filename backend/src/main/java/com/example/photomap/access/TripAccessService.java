package com.example.photomap.access;

import com.example.photomap.auditlog.SecurityAuditService;
import com.example.photomap.exceptions.PhotoMapException;
import com.example.photomap.model.TripAccess;
import com.example.photomap.model.TripRole;
import com.example.photomap.model.UserProfile;
import com.example.photomap.repo.TripAccessRepository;
import com.example.photomap.repo.TripRepository;
import com.example.photomap.repo.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class TripAccessService {

    private static final Logger log = LoggerFactory.getLogger(TripAccessService.class);

    private final TripAccessRepository tripAccess;
    private final UserProfileRepository users;
    private final TripRepository trips;
    private final SecurityAuditService auditService;
    private final Clock clock;

    public TripAccessService(TripAccessRepository tripAccess,
                             UserProfileRepository users,
                             TripRepository trips,
                             SecurityAuditService auditService,
                             Clock clock) {
        this.tripAccess = tripAccess;
        this.users = users;
        this.trips = trips;
        this.auditService = auditService;
        this.clock = clock;
    }

    public TripAccess grant(String adminId, String userId, String tripId, TripRole role) {
        UserProfile user = users.findById(userId).orElseThrow(PhotoMapException.notFound("User not found"));
        if (user.isAdmin()) {
            throw new PhotoMapException(PhotoMapException.Errors.ADMIN_GRANT_REJECTED,
                    "Cannot grant trip access to admin users (they have access to all trips)");
        }
        if (!trips.existsById(tripId)) {
            throw PhotoMapException.notFound("Trip not found").get();
        }

        TripAccess access;
        try {
            access = tripAccess.insert(TripAccess.builder()
                    .id(UUID.randomUUID().toString())
                    .userId(userId)
                    .tripId(tripId)
                    .role(role)
                    .grantedAt(clock.instant())
                    .grantedByUserId(adminId)
                    .build());
        } catch (DuplicateKeyException ex) {
            throw new PhotoMapException(PhotoMapException.Errors.ACCESS_ALREADY_GRANTED,
                    "User already has access to this trip. Use PATCH to update their role.", ex);
        }
        log.info("Trip access {} granted by {}", access.getId(), adminId);
        auditService.recordAccessGranted(adminId, access.getId(), userId, tripId);
        return access;
    }

    public List<GrantedUser> listForTrip(String tripId) {
        if (!trips.existsById(tripId)) {
            throw PhotoMapException.notFound("Trip not found").get();
        }
        List<TripAccess> grants = tripAccess.findByTripId(tripId);
        Map<String, UserProfile> profiles = grants.stream()
                .map(TripAccess::getUserId)
                .distinct()
                .map(users::findById)
                .flatMap(Optional::stream)
                .collect(Collectors.toMap(UserProfile::getId, Function.identity()));
        return grants.stream()
                .filter(grant -> profiles.containsKey(grant.getUserId()))
                .map(grant -> new GrantedUser(grant, profiles.get(grant.getUserId())))
                .toList();
    }

    public TripAccess updateRole(String adminId, String accessId, TripRole role) {
        TripAccess updated = tripAccess.updateRole(accessId, role)
                .orElseThrow(PhotoMapException.notFound("Trip access record not found"));
        auditService.recordAccessUpdated(adminId, accessId);
        return updated;
    }

    public void revoke(String adminId, String accessId) {
        if (!tripAccess.deleteById(accessId)) {
            throw PhotoMapException.notFound("Trip access record not found").get();
        }
        log.info("Trip access {} revoked by {}", accessId, adminId);
        auditService.recordAccessRevoked(adminId, accessId);
    }

    public List<UserProfile> listUsers() {
        return users.findAll();
    }

    public record GrantedUser(TripAccess access, UserProfile user) { }
}
