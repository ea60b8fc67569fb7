package com.example.photomap.access;

import com.example.photomap.exceptions.PhotoMapException;
import com.example.photomap.model.TripRole;
import com.example.photomap.repo.TripAccessRepository;
import com.example.photomap.security.AuthenticatedUser;
import org.springframework.stereotype.Component;

/**
 * Decides what an identity may do on one trip. Admins pass every check; anybody else needs a
 * grant, and the refusal never says whether the trip exists.
 */
@Component
public class TripAccessGate {

    static final String ACCESS_DENIED = "Access denied to this trip";

    private final TripAccessRepository tripAccess;

    public TripAccessGate(TripAccessRepository tripAccess) {
        this.tripAccess = tripAccess;
    }

    public EffectiveRole resolve(AuthenticatedUser user, String tripId) {
        if (user == null) {
            throw new PhotoMapException(PhotoMapException.Errors.UNAUTHORIZED, "Authentication required");
        }
        if (user.admin()) {
            return EffectiveRole.ADMIN;
        }
        return tripAccess.findByUserIdAndTripId(user.id(), tripId)
                .map(access -> EffectiveRole.of(access.getRole()))
                .orElseThrow(PhotoMapException.supply(PhotoMapException.Errors.FORBIDDEN, ACCESS_DENIED));
    }

    public EffectiveRole require(AuthenticatedUser user, String tripId, TripRole minimum) {
        EffectiveRole role = resolve(user, tripId);
        if (minimum == TripRole.EDITOR && !role.canEdit()) {
            throw new PhotoMapException(PhotoMapException.Errors.FORBIDDEN, "Editor access required for this trip");
        }
        return role;
    }
}
