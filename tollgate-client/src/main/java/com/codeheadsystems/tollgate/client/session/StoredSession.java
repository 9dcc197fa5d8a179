package com.codeheadsystems.tollgate.client.session;

import com.codeheadsystems.tollgate.model.auth.UserProfile;
import java.time.Instant;

/**
 * The persisted session.
 *
 * @param token     the bearer token
 * @param profile   the account snapshot returned at login or refresh
 * @param expiresAt when the token stops being accepted
 */
public record StoredSession(String token, UserProfile profile, Instant expiresAt) {
}
