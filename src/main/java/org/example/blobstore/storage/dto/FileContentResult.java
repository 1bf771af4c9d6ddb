package org.example.blobstore.storage.dto;

/**
 * {@code blob_read_file} 的返回结果。
 *
 * @param path      文件路径
 * @param encoding  content 的编码（utf-8 或 base64）
 * @param content   文件内容（可能被截断）
 * @param sizeBytes 文件实际大小
 * @param truncated 是否因超过上限而截断
 */
public record FileContentResult(
        String path,
        String encoding,
        String content,
        long sizeBytes,
        boolean truncated
) {
}
