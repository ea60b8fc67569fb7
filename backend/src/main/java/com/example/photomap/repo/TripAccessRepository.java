package com.example.photomap.repo;

import com.example.photomap.model.TripAccess;
import com.example.photomap.model.TripRole;

import java.util.List;
import java.util.Optional;

public interface TripAccessRepository {

    /** Fails with {@link org.springframework.dao.DuplicateKeyException} for a second (user, trip) grant. */
    TripAccess insert(TripAccess access);

    Optional<TripAccess> findById(String id);

    Optional<TripAccess> findByUserIdAndTripId(String userId, String tripId);

    List<TripAccess> findByTripId(String tripId);

    Optional<TripAccess> updateRole(String id, TripRole role);

    boolean deleteById(String id);
}
