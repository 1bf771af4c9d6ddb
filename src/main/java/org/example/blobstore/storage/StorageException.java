package org.example.blobstore.storage;

/**
 * 存储层异常基类（非受检）。
 * <p>
 * 所有“严格操作”的失败都以该类型的子类抛出，并携带操作名与调用方传入的相对路径，便于定位问题：
 * <ul>
 *   <li>{@link InvalidStoragePathException}：路径越界（安全边界），永远不会被静默裁剪。</li>
 *   <li>{@link StorageNotFoundException} / {@link StorageAlreadyExistsException}：前置条件不满足。</li>
 *   <li>{@link InvalidStorageOperationException}：底层 IO 失败（保留原始 cause）。</li>
 *   <li>{@link NoParentFolderException}：对根目录请求父目录。</li>
 * </ul>
 */
public abstract class StorageException extends RuntimeException {

    private final String operation;
    private final String path;

    protected StorageException(String operation, String path, String message) {
        this(operation, path, message, null);
    }

    protected StorageException(String operation, String path, String message, Throwable cause) {
        super(operation + "：" + message, cause);
        this.operation = operation;
        this.path = path;
    }

    /**
     * 失败的操作名（例如 {@code createFolder}）。
     */
    public String getOperation() {
        return operation;
    }

    /**
     * 调用方传入的相对路径（未经解析）。
     */
    public String getPath() {
        return path;
    }
}
