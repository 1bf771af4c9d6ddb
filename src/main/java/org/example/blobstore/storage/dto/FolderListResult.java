package org.example.blobstore.storage.dto;

import java.util.List;

/**
 * {@code blob_list_folders} 的返回结果。
 *
 * @param path    被列出的目录（不存在时已被自动创建）
 * @param folders 直接子目录（按名称排序）
 */
public record FolderListResult(String path, List<StorageFolderInfo> folders) {
}
