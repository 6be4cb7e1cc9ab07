package com.volovo.tracksync.session;

import com.volovo.tracksync.config.TrackSyncProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class FileCredentialStoreTest {

    @TempDir
    Path dir;

    private FileCredentialStore storeAt(Path file) {
        TrackSyncProperties properties = new TrackSyncProperties();
        properties.getPortal().setCredentialFile(file);
        return new FileCredentialStore(properties);
    }

    @Test
    @DisplayName("Saved cookie line survives a new store instance")
    void roundTripAcrossInstances() {
        Path file = dir.resolve("nested").resolve("cookie.txt");
        storeAt(file).save(new Credential("ASP.NET_SessionId=x; .ASPXAUTH=y", Instant.now()));

        assertThat(storeAt(file).load())
                .hasValueSatisfying(c -> assertThat(c.cookieLine()).isEqualTo("ASP.NET_SessionId=x; .ASPXAUTH=y"));
        assertThat(Files.exists(dir.resolve("nested").resolve("cookie.txt.tmp"))).isFalse();
    }

    @Test
    @DisplayName("Missing or blank file means no stored credential")
    void missingOrBlank() throws Exception {
        Path file = dir.resolve("cookie.txt");
        assertThat(storeAt(file).load()).isEmpty();

        Files.writeString(file, "  \n");
        assertThat(storeAt(file).load()).isEmpty();
    }

    @Test
    @DisplayName("Credential string form hides cookie values")
    void toStringHidesCookie() {
        Credential credential = new Credential(".ASPXAUTH=secret", Instant.EPOCH);

        assertThat(credential.toString()).doesNotContain("secret");
        assertThat(credential.hasCookie(".ASPXAUTH")).isTrue();
        assertThat(credential.hasCookie("ASP.NET_SessionId")).isFalse();
    }
}
