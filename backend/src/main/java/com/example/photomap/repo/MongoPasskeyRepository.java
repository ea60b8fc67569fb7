package com.example.photomap.repo;

import com.example.photomap.model.Passkey;
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
class MongoPasskeyRepository implements PasskeyRepository {

    private final MongoTemplate mongoTemplate;

    MongoPasskeyRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<Passkey> findByUserId(String userId) {
        return mongoTemplate.find(Query.query(Criteria.where("userId").is(userId))
                .with(Sort.by(Sort.Direction.ASC, "createdAt")), Passkey.class);
    }

    @Override
    public Optional<Passkey> findByCredentialId(String credentialId) {
        if (credentialId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findOne(
                Query.query(Criteria.where("credentialId").is(credentialId)), Passkey.class));
    }

    @Override
    public long countByUserId(String userId) {
        return mongoTemplate.count(Query.query(Criteria.where("userId").is(userId)), Passkey.class);
    }

    @Override
    public Passkey insert(Passkey passkey) {
        return mongoTemplate.insert(passkey);
    }

    @Override
    public boolean recordUse(String credentialId, long signCount, Instant usedAt) {
        Update update = new Update().set("signCount", signCount).set("lastUsedAt", usedAt);
        return mongoTemplate.updateFirst(Query.query(Criteria.where("credentialId").is(credentialId)),
                update, Passkey.class).getModifiedCount() > 0;
    }

    @Override
    public boolean delete(String userId, String credentialId) {
        Query query = Query.query(Criteria.where("userId").is(userId).and("credentialId").is(credentialId));
        return mongoTemplate.remove(query, Passkey.class).getDeletedCount() > 0;
    }

    @Override
    public long deleteByUserId(String userId) {
        return mongoTemplate.remove(Query.query(Criteria.where("userId").is(userId)), Passkey.class)
                .getDeletedCount();
    }
}
