package com.codeheadsystems.tollgate.client.model;

import java.net.URI;

/**
 * Network connection details for the authentication server.
 *
 * @param endpoint the base URL of the server (e.g. http://host:8080); endpoint paths are appended
 */
public record ServerConnectionInfo(URI endpoint) {
}
