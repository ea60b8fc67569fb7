package com.example.photomap.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.invites")
public class InviteProps {

    private Duration ttl = Duration.ofDays(7);

    /** Once the first identity exists, new identities can only register with an invite. */
    private boolean requiredAfterFirstUser = true;

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public boolean isRequiredAfterFirstUser() {
        return requiredAfterFirstUser;
    }

    public void setRequiredAfterFirstUser(boolean requiredAfterFirstUser) {
        this.requiredAfterFirstUser = requiredAfterFirstUser;
    }
}
