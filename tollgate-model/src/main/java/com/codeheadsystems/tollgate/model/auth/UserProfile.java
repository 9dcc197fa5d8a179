package com.codeheadsystems.tollgate.model.auth;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * The public view of an account. Never carries credential material.
 *
 * @param id          opaque account identifier
 * @param username    the username
 * @param email       the email address
 * @param firstName   given name
 * @param lastName    family name
 * @param fullName    display name, {@code firstName + " " + lastName}
 * @param active      whether the account may log in
 * @param lastLoginAt the last successful login or refresh, null before the first login
 * @param createdAt   when the account was registered
 */
public record UserProfile(
    @JsonProperty("id") String id,
    @JsonProperty("username") String username,
    @JsonProperty("email") String email,
    @JsonProperty("firstName") String firstName,
    @JsonProperty("lastName") String lastName,
    @JsonProperty("fullName") String fullName,
    @JsonProperty("active") boolean active,
    @JsonProperty("lastLoginAt") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant lastLoginAt,
    @JsonProperty("createdAt") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant createdAt) {
}
