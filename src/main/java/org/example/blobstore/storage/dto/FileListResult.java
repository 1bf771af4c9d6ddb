package org.example.blobstore.storage.dto;

import java.util.List;

/**
 * {@code blob_list_files} 的返回结果。
 *
 * @param path  被列出的目录
 * @param files 直接子文件（按名称排序）
 */
public record FileListResult(String path, List<StorageFileInfo> files) {
}
