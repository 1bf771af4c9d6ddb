package org.example.blobstore;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class BlobStorageApplicationTest {

    @Test
    void logDirectory_prefersSystemPropertyThenEnvironment() {
        assertThat(BlobStorageApplication.logDirectory("/var/log/blob", "/tmp/env")).isEqualTo(Path.of("/var/log/blob"));
        assertThat(BlobStorageApplication.logDirectory(" ", "/tmp/env")).isEqualTo(Path.of("/tmp/env"));
        assertThat(BlobStorageApplication.logDirectory(null, null)).isEqualTo(Path.of("logs"));
    }
}
