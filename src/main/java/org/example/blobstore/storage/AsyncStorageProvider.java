package org.example.blobstore.storage;

import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 把 {@link StorageProvider} 的每个操作派发到后台线程执行，调用线程不会阻塞在 IO 上。
 * <p>
 * 不做任何排队或加锁：提交顺序不代表执行顺序。严格操作的失败以 future 异常完成的方式返回，
 * {@code join()} 时 cause 即为对应的 {@link StorageException}。
 */
public class AsyncStorageProvider {

    private final StorageProvider delegate;
    private final Executor executor;

    public AsyncStorageProvider(StorageProvider delegate, Executor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public StorageProvider delegate() {
        return delegate;
    }

    public CompletableFuture<StorageFile> getFile(String path) {
        return CompletableFuture.supplyAsync(() -> delegate.getFile(path), executor);
    }

    public CompletableFuture<List<StorageFile>> listFiles(String path) {
        return CompletableFuture.supplyAsync(() -> delegate.listFiles(path), executor);
    }

    public CompletableFuture<List<StorageFolder>> listFolders(String path) {
        return CompletableFuture.supplyAsync(() -> delegate.listFolders(path), executor);
    }

    public CompletableFuture<Boolean> tryCreateFolder(String path) {
        return CompletableFuture.supplyAsync(() -> delegate.tryCreateFolder(path), executor);
    }

    public CompletableFuture<Void> createFolder(String path) {
        return CompletableFuture.runAsync(() -> delegate.createFolder(path), executor);
    }

    public CompletableFuture<Void> deleteFolder(String path) {
        return CompletableFuture.runAsync(() -> delegate.deleteFolder(path), executor);
    }

    public CompletableFuture<Void> renameFolder(String oldPath, String newPath) {
        return CompletableFuture.runAsync(() -> delegate.renameFolder(oldPath, newPath), executor);
    }

    public CompletableFuture<Void> deleteFile(String path) {
        return CompletableFuture.runAsync(() -> delegate.deleteFile(path), executor);
    }

    public CompletableFuture<Void> renameFile(String oldPath, String newPath) {
        return CompletableFuture.runAsync(() -> delegate.renameFile(oldPath, newPath), executor);
    }

    public CompletableFuture<StorageFile> createFile(String path) {
        return CompletableFuture.supplyAsync(() -> delegate.createFile(path), executor);
    }

    public CompletableFuture<StorageFile> createOrReplaceFile(String path) {
        return CompletableFuture.supplyAsync(() -> delegate.createOrReplaceFile(path), executor);
    }

    public CompletableFuture<Void> saveStream(String path, InputStream inputStream) {
        return CompletableFuture.runAsync(() -> delegate.saveStream(path, inputStream), executor);
    }

    public CompletableFuture<Boolean> trySaveStream(String path, InputStream inputStream) {
        return CompletableFuture.supplyAsync(() -> delegate.trySaveStream(path, inputStream), executor);
    }

    public CompletableFuture<Boolean> fileExists(String path) {
        return CompletableFuture.supplyAsync(() -> delegate.fileExists(path), executor);
    }
}
