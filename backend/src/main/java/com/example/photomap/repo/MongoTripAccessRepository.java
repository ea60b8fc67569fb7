package com.example.photomap.repo;

import com.example.photomap.model.TripAccess;
import com.example.photomap.model.TripRole;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
class MongoTripAccessRepository implements TripAccessRepository {

    private final MongoTemplate mongoTemplate;

    MongoTripAccessRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public TripAccess insert(TripAccess access) {
        return mongoTemplate.insert(access);
    }

    @Override
    public Optional<TripAccess> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findById(id, TripAccess.class));
    }

    @Override
    public Optional<TripAccess> findByUserIdAndTripId(String userId, String tripId) {
        Query query = Query.query(Criteria.where("userId").is(userId).and("tripId").is(tripId));
        return Optional.ofNullable(mongoTemplate.findOne(query, TripAccess.class));
    }

    @Override
    public List<TripAccess> findByTripId(String tripId) {
        return mongoTemplate.find(Query.query(Criteria.where("tripId").is(tripId))
                .with(Sort.by(Sort.Direction.DESC, "grantedAt")), TripAccess.class);
    }

    @Override
    public Optional<TripAccess> updateRole(String id, TripRole role) {
        return Optional.ofNullable(mongoTemplate.findAndModify(Query.query(Criteria.where("_id").is(id)),
                new Update().set("role", role), FindAndModifyOptions.options().returnNew(true), TripAccess.class));
    }

    @Override
    public boolean deleteById(String id) {
        return mongoTemplate.remove(Query.query(Criteria.where("_id").is(id)), TripAccess.class)
                .getDeletedCount() > 0;
    }
}
