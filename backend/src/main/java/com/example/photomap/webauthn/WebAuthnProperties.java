package com.example.photomap.webauthn;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Relying party settings. There are no defaults for the identity of the relying party: a
 * deployment that forgets any of them must not start.
 */
@Validated
@Component
@ConfigurationProperties(prefix = "app.webauthn")
public class WebAuthnProperties {

    @NotBlank
    private String relyingPartyId;

    @NotBlank
    private String relyingPartyName;

    @NotEmpty
    private List<String> origins = new ArrayList<>();

    private Duration challengeTtl = Duration.ofMinutes(5);

    public String getRelyingPartyId() {
        return relyingPartyId;
    }

    public void setRelyingPartyId(String relyingPartyId) {
        this.relyingPartyId = relyingPartyId;
    }

    public String getRelyingPartyName() {
        return relyingPartyName;
    }

    public void setRelyingPartyName(String relyingPartyName) {
        this.relyingPartyName = relyingPartyName;
    }

    public List<String> getOrigins() {
        return origins;
    }

    public void setOrigins(List<String> origins) {
        this.origins = origins != null ? new ArrayList<>(origins) : new ArrayList<>();
    }

    public Duration getChallengeTtl() {
        return challengeTtl;
    }

    public void setChallengeTtl(Duration challengeTtl) {
        this.challengeTtl = challengeTtl == null || challengeTtl.isNegative() || challengeTtl.isZero()
                ? Duration.ofMinutes(5) : challengeTtl;
    }
}
