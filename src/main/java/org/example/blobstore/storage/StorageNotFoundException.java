package org.example.blobstore.storage;

public class StorageNotFoundException extends StorageException {

    public StorageNotFoundException(String operation, String path, String message) {
        super(operation, path, message);
    }

    public static StorageNotFoundException file(String operation, String path) {
        return new StorageNotFoundException(operation, path, "文件不存在：" + path);
    }

    public static StorageNotFoundException folder(String operation, String path) {
        return new StorageNotFoundException(operation, path, "目录不存在：" + path);
    }
}
