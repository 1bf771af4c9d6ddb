package org.example.blobstore.storage.filesystem;

import org.example.blobstore.storage.InvalidStorageOperationException;
import org.example.blobstore.storage.StorageFile;
import org.example.blobstore.storage.StorageNotFoundException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * 本地文件系统上的文件视图。只保存相对路径与物理路径，属性在每次调用时重新读取。
 */
public class FileSystemFile implements StorageFile {

    private final String path;
    private final Path file;

    public FileSystemFile(String path, Path file) {
        this.path = path;
        this.file = file;
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public String getName() {
        return file.getFileName().toString();
    }

    @Override
    public long getSize() {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw failure("getSize", "读取文件大小失败", e);
        }
    }

    @Override
    public Instant getLastUpdated() {
        try {
            return Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            throw failure("getLastUpdated", "读取文件修改时间失败", e);
        }
    }

    @Override
    public String getFileType() {
        String name = getName();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot);
    }

    @Override
    public InputStream openRead() {
        try {
            return Files.newInputStream(file, StandardOpenOption.READ);
        } catch (IOException e) {
            throw failure("openRead", "打开文件读取失败", e);
        }
    }

    @Override
    public OutputStream openWrite() {
        return openOutput("openWrite", StandardOpenOption.WRITE);
    }

    @Override
    public OutputStream createFile() {
        return openOutput("createFile", StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    Path physicalPath() {
        return file;
    }

    private OutputStream openOutput(String operation, OpenOption... options) {
        try {
            return Files.newOutputStream(file, options);
        } catch (IOException e) {
            throw failure(operation, "打开文件写入失败", e);
        }
    }

    private RuntimeException failure(String operation, String message, IOException e) {
        if (e instanceof NoSuchFileException) {
            return StorageNotFoundException.file(operation, path);
        }
        return new InvalidStorageOperationException(operation, path, message, e);
    }

    @Override
    public String toString() {
        return "FileSystemFile[" + path + "]";
    }
}
