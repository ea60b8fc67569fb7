package com.example.photomap.webauthn;

import com.example.photomap.dto.AuthDtos.SuccessResponse;
import com.example.photomap.dto.WebAuthnDtos.OptionsResponse;
import com.example.photomap.dto.WebAuthnDtos.PasskeyAddedResponse;
import com.example.photomap.dto.WebAuthnDtos.PasskeyListResponse;
import com.example.photomap.dto.WebAuthnDtos.PasskeySummary;
import com.example.photomap.dto.WebAuthnDtos.PasskeyVerifyRequest;
import com.example.photomap.security.AuthenticatedUser;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth/passkeys")
public class PasskeyController {

    private final PasskeyService passkeyService;

    public PasskeyController(PasskeyService passkeyService) {
        this.passkeyService = passkeyService;
    }

    @GetMapping
    public PasskeyListResponse list(@AuthenticationPrincipal AuthenticatedUser user) {
        return new PasskeyListResponse(passkeyService.list(user).stream().map(PasskeySummary::from).toList());
    }

    @PostMapping("/options")
    public OptionsResponse options(@AuthenticationPrincipal AuthenticatedUser user) {
        return new OptionsResponse(passkeyService.startAddPasskey(user));
    }

    @PostMapping("/verify")
    public PasskeyAddedResponse verify(@AuthenticationPrincipal AuthenticatedUser user,
                                       @Valid @RequestBody PasskeyVerifyRequest request) {
        return new PasskeyAddedResponse(true, PasskeySummary.from(passkeyService.finishAddPasskey(user, request.credential())));
    }

    @DeleteMapping("/{credentialId}")
    public SuccessResponse delete(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable String credentialId) {
        passkeyService.delete(user, credentialId);
        return new SuccessResponse(true);
    }
}
