package org.example.blobstore.storage.filesystem;

import org.example.blobstore.storage.InvalidStorageOperationException;
import org.example.blobstore.storage.NoParentFolderException;
import org.example.blobstore.storage.StorageFolder;
import org.example.blobstore.storage.StorageNotFoundException;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;

/**
 * 本地文件系统上的目录视图。与 {@link FileSystemFile} 一样不缓存任何属性。
 */
public class FileSystemFolder implements StorageFolder {

    private final String path;
    private final Path directory;

    public FileSystemFolder(String path, Path directory) {
        this.path = path;
        this.directory = directory;
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public String getName() {
        Path name = directory.getFileName();
        return name == null ? "" : name.toString();
    }

    @Override
    public Instant getLastUpdated() {
        try {
            return Files.getLastModifiedTime(directory).toInstant();
        } catch (IOException e) {
            throw failure("getLastUpdated", "读取目录修改时间失败", e);
        }
    }

    @Override
    public long getSize() {
        // 只累加普通文件的大小，不跟随符号链接
        long[] total = {0L};
        try {
            Files.walkFileTree(directory, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        total[0] += attrs.size();
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw failure("getSize", "统计目录大小失败", e);
        }
        return total[0];
    }

    @Override
    public StorageFolder getParent() {
        Path parentDirectory = directory.getParent();
        if (path.isEmpty() || parentDirectory == null) {
            throw new NoParentFolderException(path);
        }
        int slash = path.lastIndexOf('/');
        String parentPath = slash < 0 ? "" : path.substring(0, slash);
        return new FileSystemFolder(parentPath, parentDirectory);
    }

    private RuntimeException failure(String operation, String message, IOException e) {
        if (e instanceof NoSuchFileException) {
            return StorageNotFoundException.folder(operation, path);
        }
        return new InvalidStorageOperationException(operation, path, message, e);
    }

    @Override
    public String toString() {
        return "FileSystemFolder[" + path + "]";
    }
}
