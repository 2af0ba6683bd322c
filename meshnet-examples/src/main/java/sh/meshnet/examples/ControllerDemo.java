// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.examples;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.meshnet.controller.ControllerConfig;
import sh.meshnet.controller.MeshController;
import sh.meshnet.controller.ParticipantConfig;
import sh.meshnet.core.MeshnetDebug;
import sh.meshnet.core.codec.SnapshotCodec;
import sh.meshnet.core.error.ValidationException;
import sh.meshnet.core.types.ParticipantId;

/**
 * Runs a controller locally with three simulated nodes.
 *
 * <ul>
 *   <li>{@code node-a} submits 0.91 every few seconds and stays ALLOWED</li>
 *   <li>{@code node-b} submits 0.95 once and goes stale after {@code MAX_BENCHMARK_AGE}</li>
 *   <li>{@code node-c} submits 0.40 and stays DENIED</li>
 * </ul>
 *
 * <p>Each node also runs a config agent that polls its {@link ParticipantConfig}
 * and prints membership changes. Configuration comes from the environment (see
 * {@link ControllerConfig#fromEnvironment(Map)}); the demo shortens the epoch
 * and max age unless they are set.
 *
 * <p>Usage:
 * <pre>
 * mvn -pl meshnet-examples -am package
 * java -cp ... -Dmeshnet.examples.seconds=40 -Dmeshnet.examples.debug=true \
 *   sh.meshnet.examples.ControllerDemo
 * </pre>
 */
public final class ControllerDemo {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ControllerDemo() {
    }

    public static void main(String[] args) throws Exception {
        final long runSeconds = Long.getLong("meshnet.examples.seconds", 40);
        if (Boolean.getBoolean("meshnet.examples.debug")) {
            MeshnetDebug.setEnabled(true);
        }

        final Map<String, String> env = new HashMap<>(System.getenv());
        env.putIfAbsent(ControllerConfig.ENV_EPOCH_SECONDS, "5");
        env.putIfAbsent(ControllerConfig.ENV_MAX_BENCHMARK_AGE, "15");
        env.putIfAbsent(ControllerConfig.ENV_NODE_IDS, "node-a,node-b,node-c");
        env.putIfAbsent(ControllerConfig.ENV_STATUS_FILE, Path.of("target", "status.json").toString());
        final ControllerConfig config = ControllerConfig.fromEnvironment(env);
        System.out.println("=== meshnet controller demo ===");
        System.out.println("config = " + config);

        final ScheduledExecutorService nodes = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "demo-node");
            t.setDaemon(true);
            return t;
        });
        try (MeshController controller = MeshController.builder().config(config).build()) {
            controller.start();

            // node-a: healthy, keeps submitting
            nodes.scheduleAtFixedRate(() -> emit(controller, "node-a", 0.91), 0, 3, TimeUnit.SECONDS);
            // node-b: one good submission, then silence
            nodes.schedule(() -> emit(controller, "node-b", 0.95), 0, TimeUnit.SECONDS);
            // node-c: below threshold
            nodes.scheduleAtFixedRate(() -> emit(controller, "node-c", 0.40), 0, 3, TimeUnit.SECONDS);
            // node-d: payload addressed to the wrong node, rejected
            nodes.schedule(() -> emitMismatched(controller), 1, TimeUnit.SECONDS);

            for (String id : new String[] {"node-a", "node-b", "node-c"}) {
                final ConfigAgent agent = new ConfigAgent(controller, ParticipantId.of(id));
                nodes.scheduleAtFixedRate(agent::poll, 1, 2, TimeUnit.SECONDS);
            }

            Thread.sleep(Duration.ofSeconds(runSeconds).toMillis());
            System.out.println("\n--- final status ---");
            System.out.println(new SnapshotCodec().toJson(controller.currentSnapshot()));
        } finally {
            nodes.shutdownNow();
        }
    }

    private static void emit(final MeshController controller, final String nodeId, final double overall) {
        final ObjectNode payload = MAPPER.createObjectNode();
        payload.put("node_id", nodeId);
        payload.put("timestamp", Instant.now().toString());
        payload.put("suite_version", "poc-0.1");
        final ObjectNode scores = payload.putObject("scores");
        scores.put("overall", overall);
        scores.put("refusal", Math.min(1.0, overall + 0.02));
        try {
            controller.submitJson(ParticipantId.of(nodeId), MAPPER.writeValueAsString(payload));
            System.out.println("[" + nodeId + "] submitted overall=" + overall);
        } catch (Exception e) {
            System.out.println("[" + nodeId + "] submission failed: " + e.getMessage());
        }
    }

    private static void emitMismatched(final MeshController controller) {
        final String json = "{\"node_id\":\"node-a\",\"timestamp\":\"" + Instant.now()
                + "\",\"suite_version\":\"poc-0.1\",\"scores\":{\"overall\":1.0}}";
        try {
            controller.submitJson(ParticipantId.of("node-d"), json);
        } catch (ValidationException e) {
            System.out.println("[node-d] rejected as expected: " + e.getMessage());
        }
    }

    /** Polls the controller the way a node-side agent would and reports membership changes. */
    private static final class ConfigAgent {
        private final MeshController controller;
        private final ParticipantId nodeId;
        private Boolean lastAllowed;
        private long lastEpoch;

        ConfigAgent(final MeshController controller, final ParticipantId nodeId) {
            this.controller = controller;
            this.nodeId = nodeId;
        }

        void poll() {
            final ParticipantConfig config = controller.participantConfig(nodeId);
            if (config.epochId() == lastEpoch) {
                return;
            }
            lastEpoch = config.epochId();
            if (config.allowed()) {
                // Only a prefix of the key is ever printed
                System.out.println("[" + nodeId + "] MEMBERSHIP=ALLOWED epoch=" + config.epochId()
                        + " psk=" + config.pskBase64().substring(0, 8) + "...");
            } else {
                System.out.println("[" + nodeId + "] MEMBERSHIP=DENIED epoch=" + config.epochId()
                        + " reason=" + config.reason());
            }
            if (lastAllowed == null || lastAllowed != config.allowed()) {
                lastAllowed = config.allowed();
                System.out.println("[" + nodeId + "] status changed to " + (config.allowed() ? "ALLOWED" : "DENIED"));
            }
        }
    }
}
