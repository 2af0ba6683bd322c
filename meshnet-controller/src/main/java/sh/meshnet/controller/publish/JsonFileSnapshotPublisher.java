// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller.publish;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.meshnet.core.codec.SnapshotCodec;
import sh.meshnet.core.error.PublishException;
import sh.meshnet.core.model.Snapshot;

/**
 * Writes each snapshot as a status document (see {@link SnapshotCodec}).
 *
 * <p>
 * The document is written to a temporary file in the target directory and
 * moved over the target, so readers see either the previous or the new
 * document. Falls back to a plain replace where the file system has no
 * atomic move.
 *
 * @since 0.1.0
 */
public final class JsonFileSnapshotPublisher implements SnapshotPublisher {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSnapshotPublisher.class);

    private final Path target;
    private final SnapshotCodec codec;

    public JsonFileSnapshotPublisher(final Path target) {
        this(target, new SnapshotCodec());
    }

    public JsonFileSnapshotPublisher(final Path target, final SnapshotCodec codec) {
        this.target = Objects.requireNonNull(target, "target").toAbsolutePath();
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public Path target() {
        return target;
    }

    @Override
    public void publish(final Snapshot snapshot) {
        final String json = codec.toJson(snapshot);
        Path temp = null;
        try {
            final Path dir = target.getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote status for epoch {} to {}", snapshot.epochId(), target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PublishException(snapshot.epochId(), "failed to write " + target, e);
        }
    }

    private static void deleteQuietly(final Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}", temp, e);
        }
    }
}
