package org.example.blobstore.storage;

import java.io.InputStream;
import java.time.Instant;
import java.util.List;

/**
 * 存储提供者：以“相对路径”操作文件与目录，调用方无需关心底层物理存储。
 * <p>
 * 路径约定：
 * <ul>
 *   <li>使用 / 作为分隔符，与宿主系统无关。</li>
 *   <li>{@code null} 或空字符串表示存储根目录。</li>
 *   <li>任何规范化后落在根目录之外的路径都会抛出 {@link InvalidStoragePathException}。</li>
 * </ul>
 * <p>
 * 错误约定：严格操作以 {@link StorageException} 子类报告失败；{@code try*} 与 {@link #fileExists(String)}
 * 永远不抛异常，失败时返回 {@code false}。
 * <p>
 * 实现不做任何加锁/串行化：对同一路径的并发调用由底层存储自行决定结果，需要互斥的调用方自行串行。
 */
public interface StorageProvider {

    /**
     * @throws StorageNotFoundException 文件不存在
     */
    StorageFile getFile(String path);

    /**
     * 列出目录下的直接子文件（按名称排序）；目录不存在时返回空列表。
     */
    List<StorageFile> listFiles(String path);

    /**
     * 列出目录下的直接子目录（按名称排序）。
     * <p>
     * 注意：目录不存在时会先创建该目录（保留的历史行为，不要在其他查询类操作上效仿）。
     *
     * @throws InvalidStorageOperationException 目录创建失败
     */
    List<StorageFolder> listFolders(String path);

    /**
     * 尝试创建目录：本次调用创建成功返回 {@code true}；目录已存在或任何失败返回 {@code false}。
     */
    boolean tryCreateFolder(String path);

    /**
     * 创建目录（必要时连同中间目录）。
     *
     * @throws StorageAlreadyExistsException 目录已存在
     */
    void createFolder(String path);

    /**
     * 递归删除目录及其全部内容。
     *
     * @throws StorageNotFoundException 目录不存在
     */
    void deleteFolder(String path);

    /**
     * @throws StorageNotFoundException      源目录不存在
     * @throws StorageAlreadyExistsException 目标已存在
     */
    void renameFolder(String oldPath, String newPath);

    /**
     * @throws StorageNotFoundException 文件不存在
     */
    void deleteFile(String path);

    /**
     * @throws StorageNotFoundException      源文件不存在
     * @throws StorageAlreadyExistsException 目标已存在
     */
    void renameFile(String oldPath, String newPath);

    /**
     * 创建空文件（必要时先创建父目录）。
     *
     * @throws StorageAlreadyExistsException 文件已存在
     */
    StorageFile createFile(String path);

    /**
     * 创建文件并把输入流的全部内容写入。输入流由调用方负责关闭。
     *
     * @throws StorageAlreadyExistsException    文件已存在
     * @throws InvalidStorageOperationException 写入失败
     */
    void saveStream(String path, InputStream inputStream);

    boolean fileExists(String path);

    Instant getDefaultSharedAccessExpiration();

    /**
     * 默认共享访问过期时间。文件系统实现不使用该值，供签发限时访问 URL 的实现使用。
     */
    void setDefaultSharedAccessExpiration(Instant expiration);

    default boolean trySaveStream(String path, InputStream inputStream) {
        return Attempts.succeeded("trySaveStream", path, () -> saveStream(path, inputStream));
    }

    /**
     * 文件存在则先删除，再创建一个新的空文件。
     */
    default StorageFile createOrReplaceFile(String path) {
        if (fileExists(path)) {
            deleteFile(path);
        }
        return createFile(path);
    }
}
