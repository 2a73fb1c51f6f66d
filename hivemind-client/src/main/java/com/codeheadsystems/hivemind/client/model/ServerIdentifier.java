package com.codeheadsystems.hivemind.client.model;

/**
 * Names one hive server the client talks to.
 *
 * @param id the id
 */
public record ServerIdentifier(String id) {
}
