package org.example.blobstore.storage;

/**
 * 底层 IO 失败（权限不足、磁盘已满、目录创建失败等），原始异常保存在 {@link #getCause()} 中。
 */
public class InvalidStorageOperationException extends StorageException {

    public InvalidStorageOperationException(String operation, String path, String message, Throwable cause) {
        super(operation, path, message + "：" + path, cause);
    }
}
