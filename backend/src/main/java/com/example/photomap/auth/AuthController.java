package com.example.photomap.auth;

import com.example.photomap.dto.AuthDtos.ProfileResponse;
import com.example.photomap.dto.AuthDtos.RegistrationStatusResponse;
import com.example.photomap.dto.AuthDtos.SuccessResponse;
import com.example.photomap.exceptions.PhotoMapException;
import com.example.photomap.repo.UserProfileRepository;
import com.example.photomap.security.AuthenticatedUser;
import com.example.photomap.webauthn.RegistrationService;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final UserProfileRepository users;
    private final RegistrationService registrationService;

    public AuthController(UserProfileRepository users, RegistrationService registrationService) {
        this.users = users;
        this.registrationService = registrationService;
    }

    @GetMapping("/me")
    public ProfileResponse me(@AuthenticationPrincipal AuthenticatedUser user) {
        return users.findById(user.id())
                .map(ProfileResponse::from)
                .orElseThrow(PhotoMapException.notFound("User not found"));
    }

    @GetMapping("/registration-status")
    public RegistrationStatusResponse registrationStatus() {
        boolean inviteRequired = registrationService.isInviteRequired();
        return new RegistrationStatusResponse(!inviteRequired, inviteRequired);
    }

    // Sessions are stateless bearer tokens; the client drops its copy.
    @PostMapping("/logout")
    public SuccessResponse logout() {
        return new SuccessResponse(true);
    }
}
