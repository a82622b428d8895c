package info.isaksson.erland.uitoweb.emitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * File output for generated artifacts.
 *
 * <p>Content is written to a sibling temp file and moved into place, so the target either keeps its
 * previous content or receives the complete new text. Failures are reported, never thrown.</p>
 */
public final class OutputFiles {

    private static final Logger LOG = LoggerFactory.getLogger(OutputFiles.class);

    private OutputFiles() {}

    /** Writes {@code content} as UTF-8. Returns false if anything went wrong. */
    public static boolean writeUtf8(Path target, String content) {
        if (target == null) throw new IllegalArgumentException("target must not be null");
        if (content == null) throw new IllegalArgumentException("content must not be null");

        Path absolute = target.toAbsolutePath().normalize();
        Path dir = absolute.getParent();
        Path tmp = null;
        try {
            if (dir != null) Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, absolute.getFileName().toString(), ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Wrote {} ({} chars)", absolute, content.length());
            return true;
        } catch (IOException | SecurityException e) {
            LOG.warn("Failed to write {}: {}", absolute, e.toString());
            deleteQuietly(tmp);
            return false;
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.debug("Could not remove temp file {}: {}", tmp, e.toString());
        }
    }
}
