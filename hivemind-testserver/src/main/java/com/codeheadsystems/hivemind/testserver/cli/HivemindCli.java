package com.codeheadsystems.hivemind.testserver.cli;

import com.codeheadsystems.hivemind.client.accessor.HivemindAccessor;
import com.codeheadsystems.hivemind.client.crypto.AgentKeyPair;
import com.codeheadsystems.hivemind.client.exceptions.HivemindAccessorException;
import com.codeheadsystems.hivemind.client.manager.HivemindClientManager;
import com.codeheadsystems.hivemind.client.model.AgentSession;
import com.codeheadsystems.hivemind.client.model.DeviceProof;
import com.codeheadsystems.hivemind.client.model.ServerConnectionInfo;
import com.codeheadsystems.hivemind.client.model.ServerIdentifier;
import com.codeheadsystems.hivemind.model.HiveMessage;
import com.codeheadsystems.hivemind.protocol.HivemindProtocol;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command-line agent for exercising a hive server: join, then post and/or read.
 *
 * <pre>
 * Usage:
 *   HivemindCli &lt;command&gt; [message words...] [options]
 *
 * Commands:
 *   join    Join and print the session.
 *   post    Join, post the message words, then print the hive's messages.
 *   read    Join and print the hive's messages.
 *
 * Options (environment variable in brackets):
 *   --server &lt;url&gt;     Server base URL   [HIVEMIND_URL]        (default: http://localhost:8787)
 *   --agent &lt;id&gt;       Agent id          [AGENT_ID]            (default: agent-001)
 *   --hive &lt;id&gt;        Hive id           [HIVE_ID]             (default: openclaw-devnet)
 *   --keypair &lt;path&gt;   Key file          [AGENT_KEYPAIR_PATH]  (default: ./keys/agent.json)
 *   --channel &lt;name&gt;   Channel for post                        (default: default)
 *   --since &lt;id&gt;       Read cursor                             (default: 0)
 *   --limit &lt;n&gt;        Read page size                          (default: 50)
 * </pre>
 *
 * <p>When the key file does not exist an ephemeral key is generated for this run. A device proof
 * is attached when all of OPENCLAW_DEVICE_PUBLIC_KEY, OPENCLAW_DEVICE_SIGNATURE,
 * OPENCLAW_DEVICE_NONCE and OPENCLAW_DEVICE_SIGNED_AT are set.
 */
public class HivemindCli {

  static final String DEFAULT_SERVER = "http://localhost:8787";
  static final String DEFAULT_AGENT = "agent-001";
  static final String DEFAULT_KEYPAIR = "./keys/agent.json";
  static final String DEFAULT_MESSAGE = "Hello from OpenClaw agent";

  private static final ServerIdentifier SERVER_ID = new ServerIdentifier("cli");

  /**
   * Parsed command line.
   *
   * @param command     join, post or read
   * @param server      server base URL
   * @param agentId     agent id
   * @param hiveId      hive id
   * @param keypairPath key file
   * @param channel     channel for post, null for the default
   * @param content     message text for post
   * @param since       read cursor
   * @param limit       read page size
   * @param deviceProof device proof from the environment, or null
   */
  record Options(String command,
                 String server,
                 String agentId,
                 String hiveId,
                 Path keypairPath,
                 String channel,
                 String content,
                 long since,
                 int limit,
                 DeviceProof deviceProof) {
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    Options options;
    try {
      options = parse(args, System.getenv());
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printUsage();
      System.exit(1);
      return;
    }

    ObjectMapper objectMapper = new ObjectMapper();
    HivemindAccessor accessor = new HivemindAccessor(HttpClient.newHttpClient(), objectMapper,
        Map.of(SERVER_ID, new ServerConnectionInfo(URI.create(options.server()))));
    HivemindClientManager manager = new HivemindClientManager(accessor, Clock.systemUTC());

    try {
      AgentKeyPair keyPair = loadOrGenerate(options.keypairPath(), objectMapper);
      System.out.println("Server : " + options.server());
      System.out.println("Agent  : " + options.agentId() + " (" + keyPair.publicKeyBase58() + ")");
      System.out.println("Hive   : " + options.hiveId());
      System.out.println();

      AgentSession session = manager.join(SERVER_ID, options.agentId(), keyPair, options.hiveId(),
          options.deviceProof());
      System.out.println("Joined: " + session);
      switch (options.command()) {
        case "join" -> System.out.println("  session token : " + session.token());
        case "post" -> {
          HiveMessage posted = manager.post(session, options.content(), options.channel());
          System.out.println("Posted message id=" + posted.id() + " uid=" + posted.uid());
          printMessages(objectMapper, manager.read(session, options.since(), options.limit()));
        }
        default -> printMessages(objectMapper, manager.read(session, options.since(), options.limit()));
      }
    } catch (SecurityException e) {
      System.err.println("Rejected by server: " + e.getMessage());
      System.exit(2);
    } catch (HivemindAccessorException | IOException e) {
      System.err.println("Error: " + e.getMessage());
      System.exit(1);
    }
  }

  static Options parse(String[] args, Map<String, String> env) {
    String server = env.getOrDefault("HIVEMIND_URL", DEFAULT_SERVER);
    String agentId = env.getOrDefault("AGENT_ID", DEFAULT_AGENT);
    String hiveId = env.getOrDefault("HIVE_ID", HivemindProtocol.DEFAULT_HIVE_ID);
    String keypair = env.getOrDefault("AGENT_KEYPAIR_PATH", DEFAULT_KEYPAIR);
    String channel = null;
    long since = 0L;
    int limit = 50;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--server"  -> server  = value(args, ++i);
        case "--agent"   -> agentId = value(args, ++i);
        case "--hive"    -> hiveId  = value(args, ++i);
        case "--keypair" -> keypair = value(args, ++i);
        case "--channel" -> channel = value(args, ++i);
        case "--since"   -> since   = Long.parseLong(value(args, ++i));
        case "--limit"   -> limit   = Integer.parseInt(value(args, ++i));
        default          -> positional.add(args[i]);
      }
    }

    if (positional.isEmpty()) {
      throw new IllegalArgumentException("Missing command");
    }
    String command = positional.get(0);
    if (!List.of("join", "post", "read").contains(command)) {
      throw new IllegalArgumentException("Unknown command: " + command);
    }
    String content = positional.size() > 1
        ? String.join(" ", positional.subList(1, positional.size()))
        : DEFAULT_MESSAGE;
    return new Options(command, server, agentId, hiveId, Path.of(keypair), channel, content, since, limit,
        deviceProof(env));
  }

  private static String value(String[] args, int index) {
    if (index >= args.length) {
      throw new IllegalArgumentException("Missing value for " + args[index - 1]);
    }
    return args[index];
  }

  private static DeviceProof deviceProof(Map<String, String> env) {
    String publicKey = env.get("OPENCLAW_DEVICE_PUBLIC_KEY");
    String signature = env.get("OPENCLAW_DEVICE_SIGNATURE");
    String nonce = env.get("OPENCLAW_DEVICE_NONCE");
    String signedAt = env.get("OPENCLAW_DEVICE_SIGNED_AT");
    if (isBlank(publicKey) || isBlank(signature) || isBlank(nonce) || isBlank(signedAt)) {
      return null;
    }
    return new DeviceProof(publicKey, signature, nonce, signedAt);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static AgentKeyPair loadOrGenerate(Path path, ObjectMapper objectMapper) throws IOException {
    if (Files.exists(path)) {
      return AgentKeyPair.load(path, objectMapper);
    }
    System.out.println("No key file at " + path + "; using an ephemeral key for this run.");
    return AgentKeyPair.generate(new SecureRandom());
  }

  private static void printMessages(ObjectMapper objectMapper, List<HiveMessage> messages) throws IOException {
    System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(messages));
  }

  private static void printUsage() {
    System.err.println("Usage: HivemindCli <join|post|read> [message words...] [options]");
    System.err.println();
    System.err.println("Options:");
    System.err.println("  --server <url>     Server base URL  (default: " + DEFAULT_SERVER + ")");
    System.err.println("  --agent <id>       Agent id         (default: " + DEFAULT_AGENT + ")");
    System.err.println("  --hive <id>        Hive id          (default: " + HivemindProtocol.DEFAULT_HIVE_ID + ")");
    System.err.println("  --keypair <path>   Key file         (default: " + DEFAULT_KEYPAIR + ")");
    System.err.println("  --channel <name>   Channel for post");
    System.err.println("  --since <id>       Read cursor      (default: 0)");
    System.err.println("  --limit <n>        Read page size   (default: 50)");
  }
}
