package com.example.photomap.repo;

import com.example.photomap.model.Invite;
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
class MongoInviteRepository implements InviteRepository {

    private final MongoTemplate mongoTemplate;

    MongoInviteRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Invite insert(Invite invite) {
        return mongoTemplate.insert(invite);
    }

    @Override
    public Optional<Invite> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findById(id, Invite.class));
    }

    @Override
    public Optional<Invite> findByCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findOne(Query.query(Criteria.where("code").is(code)), Invite.class));
    }

    @Override
    public void releaseExpiredSlots(String email, Instant now) {
        Query expired = Query.query(Criteria.where("activeEmail").is(email).and("expiresAt").lte(now));
        mongoTemplate.updateMulti(expired, new Update().unset("activeEmail").set("updatedAt", now), Invite.class);
    }

    @Override
    public boolean isSlotTaken(String email) {
        return mongoTemplate.exists(Query.query(Criteria.where("activeEmail").is(email)), Invite.class);
    }

    @Override
    public List<Invite> findAll() {
        return mongoTemplate.find(new Query().with(Sort.by(Sort.Direction.DESC, "createdAt")), Invite.class);
    }

    @Override
    public Optional<Invite> consume(String code, String email, String userId, Instant now) {
        Query query = Query.query(pending(now).and("code").is(code)
                .orOperator(Criteria.where("email").is(null), Criteria.where("email").is(email)));
        Update update = new Update()
                .set("usedAt", now)
                .set("usedByUserId", userId)
                .unset("activeEmail")
                .set("updatedAt", now);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), Invite.class));
    }

    @Override
    public boolean revoke(String id, Instant now) {
        Query query = Query.query(pending(now).and("_id").is(id));
        Update update = new Update()
                .set("usedAt", now)
                .set("revokedAt", now)
                .unset("activeEmail")
                .set("updatedAt", now);
        return mongoTemplate.updateFirst(query, update, Invite.class).getModifiedCount() > 0;
    }

    private Criteria pending(Instant now) {
        return Criteria.where("usedAt").is(null)
                .and("revokedAt").is(null)
                .and("expiresAt").gt(now);
    }
}
