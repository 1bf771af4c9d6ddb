package org.example.blobstore.storage;

import org.example.blobstore.storage.filesystem.FileSystemStorageProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsyncStorageProviderTest {

    @TempDir
    Path root;

    private ExecutorService executor;
    private AsyncStorageProvider async;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        async = new AsyncStorageProvider(new FileSystemStorageProvider(root), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void operationsCompleteOnBackgroundThreads() {
        async.createFolder("jobs").join();
        async.saveStream("jobs/result.txt", new ByteArrayInputStream("done".getBytes(StandardCharsets.UTF_8))).join();

        assertThat(async.fileExists("jobs/result.txt").join()).isTrue();
        assertThat(async.getFile("jobs/result.txt").join().getSize()).isEqualTo(4);
        assertThat(async.listFiles("jobs").join()).extracting(StorageFile::getName).containsExactly("result.txt");
        assertThat(async.listFolders("").join()).extracting(StorageFolder::getName).containsExactly("jobs");
    }

    @Test
    void strictFailureCompletesExceptionallyWithTypedCause() {
        assertThatThrownBy(() -> async.getFile("missing.txt").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(StorageNotFoundException.class);
        assertThatThrownBy(() -> async.createFile("../escape.txt").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(InvalidStoragePathException.class);
    }

    @Test
    void tryVariantsStillReturnBooleans() {
        assertThat(async.tryCreateFolder("../nope").join()).isFalse();
        assertThat(async.tryCreateFolder("yes").join()).isTrue();
        assertThat(async.trySaveStream("../nope.txt", new ByteArrayInputStream(new byte[0])).join()).isFalse();
    }

    @Test
    void renameAndDeleteThroughFutures() {
        async.createFile("a.txt").join();
        async.renameFile("a.txt", "b.txt").join();
        async.createFolder("dir").join();
        async.renameFolder("dir", "dir2").join();

        assertThat(async.fileExists("b.txt").join()).isTrue();

        async.createOrReplaceFile("b.txt").join();
        async.deleteFile("b.txt").join();
        async.deleteFolder("dir2").join();

        assertThat(async.delegate().listFiles("")).isEmpty();
        assertThat(async.delegate().listFolders("")).isEmpty();
    }
}
