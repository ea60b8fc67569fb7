package com.example.photomap.auth;

import com.example.photomap.dto.AuthDtos.RecoveryRequest;
import com.example.photomap.dto.AuthDtos.RecoveryResponse;
import com.example.photomap.dto.AuthDtos.RecoveryVerifyRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth/recovery")
public class RecoveryController {

    private final RecoveryService recoveryService;

    public RecoveryController(RecoveryService recoveryService) {
        this.recoveryService = recoveryService;
    }

    @PostMapping("/request")
    public RecoveryResponse request(@Valid @RequestBody RecoveryRequest request) {
        recoveryService.requestRecovery(request.email());
        return new RecoveryResponse(true, "If account exists, recovery code sent", null);
    }

    @PostMapping("/verify")
    public RecoveryResponse verify(@Valid @RequestBody RecoveryVerifyRequest request) {
        recoveryService.verifyRecovery(request.email(), request.code());
        return new RecoveryResponse(true, "Recovery successful. Please register a new passkey.", "/register");
    }
}
