package org.example.blobstore.storage.dto;

/**
 * 写类操作的返回结果。
 *
 * @param operation  操作名
 * @param path       操作路径（重命名时为源路径）
 * @param targetPath 重命名的目标路径（其他操作为 null）
 * @param success    是否成功（严格操作失败时直接抛异常，因此只有 try 模式会返回 false）
 */
public record StorageOperationResult(
        String operation,
        String path,
        String targetPath,
        boolean success
) {
}
