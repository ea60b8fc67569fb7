package com.example.photomap.repo;

import com.example.photomap.model.RecoveryToken;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
class MongoRecoveryTokenRepository implements RecoveryTokenRepository {

    private final MongoTemplate mongoTemplate;

    MongoRecoveryTokenRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public RecoveryToken insert(RecoveryToken token) {
        return mongoTemplate.insert(token);
    }

    @Override
    public long invalidateActive(String userId) {
        Query query = Query.query(Criteria.where("userId").is(userId)
                .and("usedAt").is(null)
                .and("lockedAt").is(null));
        return mongoTemplate.remove(query, RecoveryToken.class).getDeletedCount();
    }

    @Override
    public Optional<RecoveryToken> findLatestUnused(String userId, Instant now) {
        Query query = Query.query(Criteria.where("userId").is(userId)
                        .and("usedAt").is(null)
                        .and("expiresAt").gt(now))
                .with(Sort.by(Sort.Direction.DESC, "createdAt"))
                .limit(1);
        return Optional.ofNullable(mongoTemplate.findOne(query, RecoveryToken.class));
    }

    @Override
    public Optional<RecoveryToken> recordFailedAttempt(String tokenId, int maxAttempts, Instant now) {
        Query open = Query.query(usable(tokenId, maxAttempts));
        RecoveryToken updated = mongoTemplate.findAndModify(open, new Update().inc("attempts", 1),
                FindAndModifyOptions.options().returnNew(true), RecoveryToken.class);
        if (updated == null) {
            return Optional.empty();
        }
        if (updated.getAttempts() >= maxAttempts) {
            mongoTemplate.updateFirst(
                    Query.query(Criteria.where("_id").is(tokenId).and("lockedAt").is(null)),
                    new Update().set("lockedAt", now), RecoveryToken.class);
            updated.setLockedAt(now);
        }
        return Optional.of(updated);
    }

    @Override
    public boolean claim(String tokenId, int maxAttempts, Instant now) {
        Query query = Query.query(usable(tokenId, maxAttempts).and("expiresAt").gt(now));
        return mongoTemplate.updateFirst(query, new Update().set("usedAt", now), RecoveryToken.class)
                .getModifiedCount() > 0;
    }

    // The attempts bound is what closes the token; lockedAt is written afterwards as a marker.
    private Criteria usable(String tokenId, int maxAttempts) {
        return Criteria.where("_id").is(tokenId)
                .and("usedAt").is(null)
                .and("lockedAt").is(null)
                .and("attempts").lt(maxAttempts);
    }
}
