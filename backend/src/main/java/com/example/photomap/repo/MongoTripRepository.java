package com.example.photomap.repo;

import com.example.photomap.model.Trip;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
class MongoTripRepository implements TripRepository {

    private final MongoTemplate mongoTemplate;

    MongoTripRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public boolean existsById(String id) {
        return id != null && mongoTemplate.exists(Query.query(Criteria.where("_id").is(id)), Trip.class);
    }

    @Override
    public List<Trip> findAllById(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return mongoTemplate.find(Query.query(Criteria.where("_id").in(ids)), Trip.class);
    }
}
