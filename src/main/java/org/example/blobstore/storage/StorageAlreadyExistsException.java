package org.example.blobstore.storage;

public class StorageAlreadyExistsException extends StorageException {

    public StorageAlreadyExistsException(String operation, String path, String message) {
        super(operation, path, message);
    }

    public static StorageAlreadyExistsException file(String operation, String path) {
        return new StorageAlreadyExistsException(operation, path, "文件已存在：" + path);
    }

    public static StorageAlreadyExistsException folder(String operation, String path) {
        return new StorageAlreadyExistsException(operation, path, "目录已存在：" + path);
    }
}
