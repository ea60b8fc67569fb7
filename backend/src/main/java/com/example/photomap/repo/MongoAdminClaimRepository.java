package com.example.photomap.repo;

import com.example.photomap.model.AdminClaim;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
class MongoAdminClaimRepository implements AdminClaimRepository {

    private final MongoTemplate mongoTemplate;

    MongoAdminClaimRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public boolean tryClaim(String claimantId, Instant now) {
        // A duplicate key inside a transaction aborts it, so an existing claim is read first.
        Query claimed = Query.query(Criteria.where("_id").is(AdminClaim.FIRST_ADMIN));
        if (mongoTemplate.exists(claimed, AdminClaim.class)) {
            return false;
        }
        try {
            mongoTemplate.insert(AdminClaim.builder()
                    .id(AdminClaim.FIRST_ADMIN)
                    .claimant(claimantId)
                    .claimedAt(now)
                    .build());
            return true;
        } catch (DuplicateKeyException ex) {
            throw new TransientDataAccessResourceException("First admin claimed by a concurrent registration", ex);
        }
    }
}
