package com.example.photomap.webauthn;

/**
 * What an options call leaves behind for the matching verify call.
 *
 * @param requestJson serialized WebAuthn request, carries the challenge bytes
 * @param userId      existing identity the ceremony is bound to, null for a brand new identity
 * @param userHandle  WebAuthn user handle the authenticator was given, registration only
 * @param displayName display name chosen at registration options
 * @param inviteCode  invite that was validated at registration options
 */
public record PendingChallenge(ChallengePurpose purpose,
                               String requestJson,
                               String userId,
                               String userHandle,
                               String displayName,
                               String inviteCode) {

    public static PendingChallenge login(String requestJson, String userId) {
        return new PendingChallenge(ChallengePurpose.LOGIN, requestJson, userId, null, null, null);
    }

    public boolean isFor(ChallengePurpose expected) {
        return purpose == expected;
    }
}
