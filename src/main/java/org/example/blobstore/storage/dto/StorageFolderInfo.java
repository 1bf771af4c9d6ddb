package org.example.blobstore.storage.dto;

import java.time.Instant;

/**
 * 目录信息。
 *
 * @param path          相对存储根目录的路径（统一使用 / 分隔）
 * @param name          目录名
 * @param parentPath    父目录路径（根目录下的一级目录为空字符串）
 * @param sizeBytes     递归统计的文件大小之和（未请求时为 null）
 * @param lastUpdatedAt 最后修改时间
 */
public record StorageFolderInfo(
        String path,
        String name,
        String parentPath,
        Long sizeBytes,
        Instant lastUpdatedAt
) {
}
