package com.example.photomap.access;

import com.example.photomap.exceptions.PhotoMapException;
import com.example.photomap.model.TripAccess;
import com.example.photomap.model.TripRole;
import com.example.photomap.security.AuthenticatedUser;
import com.example.photomap.support.InMemoryTripAccessRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TripAccessGateTest {

    private static final AuthenticatedUser ADMIN = new AuthenticatedUser("admin-1", "owner@example.com", true);
    private static final AuthenticatedUser VIEWER = new AuthenticatedUser("user-1", "viewer@example.com", false);
    private static final AuthenticatedUser EDITOR = new AuthenticatedUser("user-2", "editor@example.com", false);
    private static final AuthenticatedUser STRANGER = new AuthenticatedUser("user-3", "stranger@example.com", false);

    private TripAccessGate gate;

    @BeforeEach
    void setUp() {
        InMemoryTripAccessRepository repository = new InMemoryTripAccessRepository();
        repository.insert(grant("a-1", VIEWER.id(), TripRole.VIEWER));
        repository.insert(grant("a-2", EDITOR.id(), TripRole.EDITOR));
        gate = new TripAccessGate(repository);
    }

    @Test
    void adminPassesWithoutAGrant() {
        assertThat(gate.resolve(ADMIN, "trip-1")).isEqualTo(EffectiveRole.ADMIN);
        assertThat(gate.require(ADMIN, "any-trip", TripRole.EDITOR)).isEqualTo(EffectiveRole.ADMIN);
    }

    @Test
    void grantDecidesTheRole() {
        assertThat(gate.resolve(VIEWER, "trip-1")).isEqualTo(EffectiveRole.VIEWER);
        assertThat(gate.require(EDITOR, "trip-1", TripRole.EDITOR)).isEqualTo(EffectiveRole.EDITOR);
        assertThat(gate.require(VIEWER, "trip-1", TripRole.VIEWER)).isEqualTo(EffectiveRole.VIEWER);
    }

    @Test
    void viewerCannotEdit() {
        assertThatThrownBy(() -> gate.require(VIEWER, "trip-1", TripRole.EDITOR))
                .isInstanceOf(PhotoMapException.class)
                .hasMessage("Editor access required for this trip")
                .extracting("error")
                .isEqualTo(PhotoMapException.Errors.FORBIDDEN);
    }

    @Test
    void noGrantAndUnknownTripAreTheSameRefusal() {
        assertThatThrownBy(() -> gate.resolve(STRANGER, "trip-1"))
                .hasMessage(TripAccessGate.ACCESS_DENIED);
        assertThatThrownBy(() -> gate.resolve(VIEWER, "trip-that-does-not-exist"))
                .hasMessage(TripAccessGate.ACCESS_DENIED);
    }

    @Test
    void anonymousIsUnauthorized() {
        assertThatThrownBy(() -> gate.resolve(null, "trip-1"))
                .extracting("error")
                .isEqualTo(PhotoMapException.Errors.UNAUTHORIZED);
    }

    private static TripAccess grant(String id, String userId, TripRole role) {
        return TripAccess.builder()
                .id(id)
                .userId(userId)
                .tripId("trip-1")
                .role(role)
                .grantedAt(Instant.parse("2024-06-01T10:00:00Z"))
                .grantedByUserId(ADMIN.id())
                .build();
    }
}
