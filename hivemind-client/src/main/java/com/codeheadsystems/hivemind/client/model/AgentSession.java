package com.codeheadsystems.hivemind.client.model;

/**
 * A joined agent's bearer session on one server.
 *
 * @param serverId  server the session belongs to
 * @param agentId   the agent
 * @param hiveId    hive the session is bound to
 * @param token     opaque bearer token
 * @param expiresAt expiry as reported by the server
 */
public record AgentSession(ServerIdentifier serverId,
                           String agentId,
                           String hiveId,
                           String token,
                           String expiresAt) {

  @Override
  public String toString() {
    return "AgentSession{server=" + serverId.id() + ", agent=" + agentId + ", hive=" + hiveId
        + ", expiresAt=" + expiresAt + "}";
  }
}
