package org.example.blobstore.storage;

/**
 * 路径解析失败：规范化后的路径不在根目录范围内，或路径本身无法解析。
 */
public class InvalidStoragePathException extends StorageException {

    public InvalidStoragePathException(String operation, String path) {
        super(operation, path, "路径不在存储根目录范围内：" + path);
    }

    public InvalidStoragePathException(String operation, String path, Throwable cause) {
        super(operation, path, "路径无法解析：" + path, cause);
    }
}
