package com.example.photomap.identity;

import com.example.photomap.model.Invite;
import com.example.photomap.model.Passkey;
import com.example.photomap.model.UserProfile;

/** Result of a committed registration; {@code invite} is null when none was used. */
public record CreatedIdentity(UserProfile user, Passkey passkey, Invite invite) {
}
