package com.example.photomap.repo;

import com.example.photomap.model.UserProfile;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
class MongoUserProfileRepository implements UserProfileRepository {

    private final MongoTemplate mongoTemplate;

    MongoUserProfileRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<UserProfile> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findById(id, UserProfile.class));
    }

    @Override
    public Optional<UserProfile> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findOne(
                Query.query(Criteria.where("email").is(email)), UserProfile.class));
    }

    @Override
    public List<UserProfile> findAll() {
        return mongoTemplate.find(new Query().with(Sort.by(Sort.Direction.ASC, "email")), UserProfile.class);
    }

    @Override
    public long count() {
        return mongoTemplate.count(new Query(), UserProfile.class);
    }

    @Override
    public UserProfile insert(UserProfile profile) {
        return mongoTemplate.insert(profile);
    }

    @Override
    public boolean touch(String id, Instant now) {
        return mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(id)),
                new Update().set("updatedAt", now), UserProfile.class).getMatchedCount() > 0;
    }

    @Override
    public void markAdmin(String id, Instant now) {
        mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(id)),
                new Update().set("admin", true).set("updatedAt", now), UserProfile.class);
    }
}
