package com.example.photomap.webauthn;

import com.example.photomap.dto.AuthDtos.AuthResponse;
import com.example.photomap.dto.AuthDtos.PublicUser;
import com.example.photomap.dto.WebAuthnDtos.LoginOptionsRequest;
import com.example.photomap.dto.WebAuthnDtos.LoginVerifyRequest;
import com.example.photomap.dto.WebAuthnDtos.OptionsResponse;
import com.example.photomap.dto.WebAuthnDtos.RegistrationOptionsRequest;
import com.example.photomap.dto.WebAuthnDtos.RegistrationVerifyRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
public class WebAuthnController {

    private final RegistrationService registrationService;
    private final LoginService loginService;

    public WebAuthnController(RegistrationService registrationService, LoginService loginService) {
        this.registrationService = registrationService;
        this.loginService = loginService;
    }

    @PostMapping("/register/options")
    public OptionsResponse registrationOptions(@Valid @RequestBody RegistrationOptionsRequest request) {
        return new OptionsResponse(registrationService.startRegistration(
                request.email(), request.displayName(), request.inviteCode()));
    }

    @PostMapping("/register/verify")
    public AuthResponse registrationVerify(@Valid @RequestBody RegistrationVerifyRequest request) {
        return toResponse(registrationService.finishRegistration(request.email(), request.credential()));
    }

    @PostMapping("/login/options")
    public OptionsResponse loginOptions(@Valid @RequestBody LoginOptionsRequest request) {
        return new OptionsResponse(loginService.startLogin(request.email()));
    }

    @PostMapping("/login/verify")
    public AuthResponse loginVerify(@Valid @RequestBody LoginVerifyRequest request) {
        return toResponse(loginService.finishLogin(request.email(), request.credential()));
    }

    private AuthResponse toResponse(AuthenticatedSession session) {
        return new AuthResponse(PublicUser.from(session.user()), session.token());
    }
}
