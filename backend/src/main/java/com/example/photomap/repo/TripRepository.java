package com.example.photomap.repo;

import com.example.photomap.model.Trip;

import java.util.Collection;
import java.util.List;

public interface TripRepository {

    boolean existsById(String id);

    List<Trip> findAllById(Collection<String> ids);
}
