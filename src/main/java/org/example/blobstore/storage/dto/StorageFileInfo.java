package org.example.blobstore.storage.dto;

import java.time.Instant;

/**
 * 文件信息。
 *
 * @param path          相对存储根目录的路径（统一使用 / 分隔）
 * @param name          文件名
 * @param fileType      扩展名（含点；没有扩展名时为空字符串）
 * @param sizeBytes     文件大小
 * @param lastUpdatedAt 最后修改时间
 */
public record StorageFileInfo(
        String path,
        String name,
        String fileType,
        long sizeBytes,
        Instant lastUpdatedAt
) {
}
