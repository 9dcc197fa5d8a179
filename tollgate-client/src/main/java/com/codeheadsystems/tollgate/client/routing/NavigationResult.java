package com.codeheadsystems.tollgate.client.routing;

/**
 * Where a navigation attempt ended up.
 *
 * @param requestedUrl the destination asked for
 * @param location     the destination actually entered
 * @param routeName    the name of the entered route
 * @param redirected   whether a guard or redirect route changed the destination
 */
public record NavigationResult(String requestedUrl, String location, String routeName,
                               boolean redirected) {
}
