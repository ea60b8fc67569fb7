package com.example.photomap.invite;

import com.example.photomap.dto.InviteDtos.CreateInviteRequest;
import com.example.photomap.dto.InviteDtos.CreateInviteResponse;
import com.example.photomap.dto.InviteDtos.InviteListItem;
import com.example.photomap.dto.InviteDtos.InviteListResponse;
import com.example.photomap.dto.InviteDtos.InviteSummary;
import com.example.photomap.dto.InviteDtos.InviteValidationResponse;
import com.example.photomap.dto.InviteDtos.InviteView;
import com.example.photomap.dto.InviteDtos.RevokeInviteResponse;
import com.example.photomap.dto.InviteDtos.TripSummary;
import com.example.photomap.model.Invite;
import com.example.photomap.model.TripRole;
import com.example.photomap.security.AuthenticatedUser;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/invites")
public class InviteController {

    private final InviteService inviteService;

    public InviteController(InviteService inviteService) {
        this.inviteService = inviteService;
    }

    @PostMapping
    public ResponseEntity<CreateInviteResponse> create(@AuthenticationPrincipal AuthenticatedUser admin,
                                                       @Valid @RequestBody CreateInviteRequest request) {
        Invite invite = inviteService.create(admin.id(), request.email(), TripRole.fromValue(request.role()),
                request.tripIds());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new CreateInviteResponse(InviteView.from(invite), invite.getTripIds()));
    }

    @GetMapping
    public InviteListResponse list() {
        return new InviteListResponse(inviteService.list().stream()
                .map(overview -> InviteListItem.from(overview.invite(), overview.status()))
                .toList());
    }

    @DeleteMapping("/{id}")
    public RevokeInviteResponse revoke(@AuthenticationPrincipal AuthenticatedUser admin, @PathVariable String id) {
        inviteService.revoke(admin.id(), id);
        return new RevokeInviteResponse(true, "Invite revoked");
    }

    @GetMapping("/validate/{code}")
    public ResponseEntity<InviteValidationResponse> validate(@PathVariable String code) {
        return inviteService.validate(code)
                .map(valid -> ResponseEntity.ok(new InviteValidationResponse(true,
                        new InviteSummary(valid.invite().getEmail(), valid.invite().getRole(), valid.invite().getExpiresAt()),
                        valid.trips().stream().map(TripSummary::from).toList(),
                        null)))
                .orElseGet(() -> ResponseEntity.badRequest().body(InviteValidationResponse.invalid()));
    }
}
