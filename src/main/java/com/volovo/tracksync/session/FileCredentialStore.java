package com.volovo.tracksync.session;

import com.volovo.tracksync.config.TrackSyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the cookie line in a plain text file.
 *
 * The file is the only state shared between processes. Two sync processes
 * started in parallel against the same file can both log in and overwrite
 * each other's cookie; the write itself is atomic (temp file + move), the
 * login race is not guarded here. Run one sync process per credential file.
 */
@Component
@Slf4j
public class FileCredentialStore implements CredentialStore {

    private final Path file;

    public FileCredentialStore(TrackSyncProperties properties) {
        this.file = properties.getPortal().getCredentialFile();
    }

    @Override
    public Optional<Credential> load() {
        try {
            String line = Files.readString(file, StandardCharsets.UTF_8).trim();
            if (line.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new Credential(line, Files.getLastModifiedTime(file).toInstant()));
        } catch (NoSuchFileException e) {
            log.debug("No stored credential at {}", file);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Stored credential at {} unreadable: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(Credential credential) {
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, credential.cookieLine(), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Credential saved to {} (acquired {})", file, credential.acquiredAt());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write credential file " + file, e);
        }
    }
}
