package com.codeheadsystems.hivemind.client.model;

import java.net.URI;

/**
 * Network connection details for a single hive server.
 *
 * @param endpoint base URL of the server (e.g. http://host:8080); paths are appended per call
 */
public record ServerConnectionInfo(URI endpoint) {
}
