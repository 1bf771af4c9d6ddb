package org.example.blobstore.storage.filesystem;

import org.example.blobstore.storage.InvalidStoragePathException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoragePathResolverTest {

    @TempDir
    Path tempDir;

    private Path root;
    private StoragePathResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tempDir.resolve("data"));
        resolver = new StoragePathResolver(root, PathCaseSensitivity.SENSITIVE);
    }

    @Test
    void resolve_emptyOrNullMeansRoot() {
        StoragePathResolver.ResolvedPath empty = resolver.resolve("test", "");
        StoragePathResolver.ResolvedPath none = resolver.resolve("test", null);

        assertThat(empty.isRoot()).isTrue();
        assertThat(empty.absolutePath()).isEqualTo(root);
        assertThat(none.relativePath()).isEmpty();
        assertThat(none.absolutePath()).isEqualTo(root);
    }

    @Test
    void resolve_nestedPathStaysUnderRoot() {
        StoragePathResolver.ResolvedPath resolved = resolver.resolve("test", "a/b/c/d.txt");

        assertThat(resolved.relativePath()).isEqualTo("a/b/c/d.txt");
        assertThat(resolved.absolutePath()).isEqualTo(root.resolve("a").resolve("b").resolve("c").resolve("d.txt"));
        assertThat(resolved.absolutePath().startsWith(root)).isTrue();
    }

    @Test
    void resolve_dotSegmentsThatStayInsideAreNormalized() {
        StoragePathResolver.ResolvedPath resolved = resolver.resolve("test", "a/./b/../c/");

        assertThat(resolved.relativePath()).isEqualTo("a/c");
        assertThat(resolved.absolutePath()).isEqualTo(root.resolve("a").resolve("c"));
        assertThat(resolver.resolve("test", "a/..").isRoot()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "..",
            "../outside.txt",
            "a/../../outside",
            "a/b/../../../../etc/passwd",
            "../../etc",
            "/etc/passwd",
            "../data2/file.txt"
    })
    void resolve_rejectsPathsOutsideRoot(String path) throws IOException {
        Files.createDirectories(tempDir.resolve("data2"));

        assertThatThrownBy(() -> resolver.resolve("test", path))
                .isInstanceOf(InvalidStoragePathException.class)
                .satisfies(e -> assertThat(((InvalidStoragePathException) e).getPath()).isEqualTo(path));
    }

    @Test
    void resolve_rejectsSiblingThatSharesRootPrefix() throws IOException {
        Files.createDirectories(tempDir.resolve("database"));

        assertThatThrownBy(() -> resolver.resolve("test", "../database/x"))
                .isInstanceOf(InvalidStoragePathException.class);
    }

    @Test
    void resolve_doesNotTouchFilesystem() {
        assertThatThrownBy(() -> resolver.resolve("test", "../escaped/deep"))
                .isInstanceOf(InvalidStoragePathException.class);
        resolver.resolve("test", "new/deep/folder");

        assertThat(tempDir.resolve("escaped")).doesNotExist();
        assertThat(root.resolve("new")).doesNotExist();
    }

    @Test
    void resolve_malformedPathIsInvalidNotPropagated() {
        assertThatThrownBy(() -> resolver.resolve("test", "bad\u0000name"))
                .isInstanceOf(InvalidStoragePathException.class)
                .hasCauseInstanceOf(java.nio.file.InvalidPathException.class);
    }

    @Test
    void resolve_rejectsSymlinkPointingOutsideRoot() throws IOException {
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Files.writeString(outside.resolve("secret.txt"), "secret");
        Files.createSymbolicLink(root.resolve("escape"), outside);

        assertThatThrownBy(() -> resolver.resolve("test", "escape/secret.txt"))
                .isInstanceOf(InvalidStoragePathException.class);
        assertThatThrownBy(() -> resolver.resolve("test", "escape/not-yet-created"))
                .isInstanceOf(InvalidStoragePathException.class);
    }

    @Test
    void resolve_acceptsSymlinkPointingInsideRoot() throws IOException {
        Path target = Files.createDirectories(root.resolve("real"));
        Files.createSymbolicLink(root.resolve("alias"), target);

        StoragePathResolver.ResolvedPath resolved = resolver.resolve("test", "alias/file.txt");

        assertThat(resolved.relativePath()).isEqualTo("alias/file.txt");
    }

    @Test
    void resolve_rejectsDanglingSymlink() throws IOException {
        Files.createSymbolicLink(root.resolve("dangling"), tempDir.resolve("missing"));

        assertThatThrownBy(() -> resolver.resolve("test", "dangling"))
                .isInstanceOf(InvalidStoragePathException.class);
    }

    @Test
    void resolve_caseInsensitiveComparisonAcceptsDifferentlyCasedRoot() {
        StoragePathResolver insensitive = new StoragePathResolver(root, PathCaseSensitivity.INSENSITIVE);

        StoragePathResolver.ResolvedPath resolved = insensitive.resolve("test", "../DATA/x.txt");

        assertThat(resolved.relativePath()).isEqualTo("x.txt");
        assertThat(resolved.absolutePath()).isEqualTo(root.resolve("x.txt"));
    }

    @Test
    void resolve_caseSensitiveComparisonRejectsDifferentlyCasedRoot() {
        assertThatThrownBy(() -> resolver.resolve("test", "../DATA/x.txt"))
                .isInstanceOf(InvalidStoragePathException.class);
    }

    @Test
    void caseSensitivity_autoFollowsHostFamily() {
        assertThat(PathCaseSensitivity.hostIsCaseInsensitive("Windows 11")).isTrue();
        assertThat(PathCaseSensitivity.hostIsCaseInsensitive("Mac OS X")).isTrue();
        assertThat(PathCaseSensitivity.hostIsCaseInsensitive("Linux")).isFalse();
        assertThat(PathCaseSensitivity.SENSITIVE.isCaseInsensitive()).isFalse();
        assertThat(PathCaseSensitivity.INSENSITIVE.isCaseInsensitive()).isTrue();
    }
}
