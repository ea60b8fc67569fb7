package com.example.photomap.invite;

import com.example.photomap.auditlog.SecurityAuditService;
import com.example.photomap.config.InviteProps;
import com.example.photomap.exceptions.PhotoMapException;
import com.example.photomap.identity.Emails;
import com.example.photomap.model.Invite;
import com.example.photomap.model.InviteStatus;
import com.example.photomap.model.Trip;
import com.example.photomap.model.TripRole;
import com.example.photomap.repo.InviteRepository;
import com.example.photomap.repo.TripRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Service
public class InviteService {

    private static final Logger log = LoggerFactory.getLogger(InviteService.class);

    static final String INVALID_INVITE_MESSAGE = "Invalid or expired invite";

    private final InviteRepository invites;
    private final TripRepository trips;
    private final InviteCodeGenerator codeGenerator;
    private final InviteProps props;
    private final SecurityAuditService auditService;
    private final Clock clock;

    public InviteService(InviteRepository invites,
                         TripRepository trips,
                         InviteCodeGenerator codeGenerator,
                         InviteProps props,
                         SecurityAuditService auditService,
                         Clock clock) {
        this.invites = invites;
        this.trips = trips;
        this.codeGenerator = codeGenerator;
        this.props = props;
        this.auditService = auditService;
        this.clock = clock;
    }

    public Invite create(String adminId, String email, TripRole role, Collection<String> tripIds) {
        String normalizedEmail = Emails.normalize(email);
        List<String> uniqueTripIds = new ArrayList<>(new LinkedHashSet<>(tripIds == null ? List.of() : tripIds));
        PhotoMapException.checkOrThrow(!uniqueTripIds.isEmpty(), PhotoMapException.Errors.VALIDATION_FAILED,
                "At least one trip is required");

        Instant now = clock.instant();
        if (trips.findAllById(uniqueTripIds).size() != uniqueTripIds.size()) {
            throw new PhotoMapException(PhotoMapException.Errors.VALIDATION_FAILED, "One or more trip IDs do not exist");
        }

        Invite invite = Invite.builder()
                .id(UUID.randomUUID().toString())
                .code(codeGenerator.generate())
                .createdByUserId(adminId)
                .email(normalizedEmail)
                .activeEmail(normalizedEmail)
                .role(role)
                .tripIds(uniqueTripIds)
                .expiresAt(now.plus(props.getTtl()))
                .createdAt(now)
                .updatedAt(now)
                .build();
        invites.releaseExpiredSlots(normalizedEmail, now);
        try {
            invite = invites.insert(invite);
        } catch (DuplicateKeyException ex) {
            if (invites.isSlotTaken(normalizedEmail)) {
                throw new PhotoMapException(PhotoMapException.Errors.INVITE_ALREADY_ACTIVE,
                        "An active invite already exists for this email");
            }
            throw new PhotoMapException(PhotoMapException.Errors.INTERNAL_ERROR,
                    "Could not allocate an invite code, please retry", ex);
        }
        log.info("Invite {} created by {} for {} trip(s)", invite.getId(), adminId, uniqueTripIds.size());
        auditService.recordInviteCreated(adminId, invite.getId(), uniqueTripIds.size());
        return invite;
    }

    public List<InviteOverview> list() {
        Instant now = clock.instant();
        return invites.findAll().stream()
                .map(invite -> new InviteOverview(invite, invite.statusAt(now)))
                .toList();
    }

    public void revoke(String adminId, String inviteId) {
        Instant now = clock.instant();
        Invite invite = invites.findById(inviteId).orElseThrow(PhotoMapException.notFound("Invite not found"));
        switch (invite.statusAt(now)) {
            case USED -> throw new PhotoMapException(PhotoMapException.Errors.INVITE_NOT_REVOCABLE,
                    "Cannot revoke an invite that has already been used");
            case REVOKED -> throw new PhotoMapException(PhotoMapException.Errors.INVITE_NOT_REVOCABLE,
                    "Invite has already been revoked");
            case EXPIRED -> throw new PhotoMapException(PhotoMapException.Errors.INVITE_NOT_REVOCABLE,
                    "Cannot revoke an expired invite");
            default -> {
            }
        }
        if (!invites.revoke(inviteId, now)) {
            // consumed or expired between the read and the conditional update
            throw new PhotoMapException(PhotoMapException.Errors.INVITE_NOT_REVOCABLE, "Invite is no longer pending");
        }
        log.info("Invite {} revoked by {}", inviteId, adminId);
        auditService.recordInviteRevoked(adminId, inviteId);
    }

    /**
     * Public lookup. Every unusable code, whatever the reason, yields an empty result so the
     * caller cannot tell unknown from used, revoked or expired.
     */
    public Optional<ValidInvite> validate(String code) {
        if (!InviteCodeGenerator.isWellFormed(code)) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        return invites.findByCode(code)
                .filter(invite -> invite.isUsableAt(now))
                .map(invite -> new ValidInvite(invite, trips.findAllById(invite.getTripIds())));
    }

    /** Registration options with an invite: the invite must be usable and bound to this email. */
    public Invite requireUsableFor(String code, String email) {
        return validate(code)
                .map(ValidInvite::invite)
                .filter(invite -> invite.getEmail() == null || Objects.equals(invite.getEmail(), Emails.normalize(email)))
                .orElseThrow(PhotoMapException.supply(PhotoMapException.Errors.INVALID_INVITE, INVALID_INVITE_MESSAGE));
    }

    /** Called inside the registration transaction. */
    public Invite consume(String code, String email, String userId) {
        Invite invite = invites.consume(code, Emails.normalize(email), userId, clock.instant())
                .orElseThrow(PhotoMapException.supply(PhotoMapException.Errors.INVALID_INVITE, INVALID_INVITE_MESSAGE));
        auditService.recordInviteConsumed(userId, invite.getId());
        return invite;
    }

    public record ValidInvite(Invite invite, List<Trip> trips) { }

    public record InviteOverview(Invite invite, InviteStatus status) { }
}
