package org.example.blobstore.mcp;

import org.example.blobstore.storage.Attempts;
import org.example.blobstore.storage.InvalidStorageOperationException;
import org.example.blobstore.storage.StorageFile;
import org.example.blobstore.storage.StorageFolder;
import org.example.blobstore.storage.StorageProvider;
import org.example.blobstore.storage.dto.FileContentResult;
import org.example.blobstore.storage.dto.FileListResult;
import org.example.blobstore.storage.dto.FolderListResult;
import org.example.blobstore.storage.dto.StorageFileInfo;
import org.example.blobstore.storage.dto.StorageFolderInfo;
import org.example.blobstore.storage.dto.StorageOperationResult;
import org.example.blobstore.storage.filesystem.BlobStorageProperties;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * 存储 MCP 工具集合：把 {@link StorageProvider} 的每个操作暴露为一个 MCP 工具。
 * <p>
 * 约定：
 * <ul>
 *   <li>所有路径都是相对存储根目录的路径，使用 / 分隔，空字符串表示根目录。</li>
 *   <li>严格操作失败时直接抛出异常，由 MCP 层作为工具错误返回给调用方。</li>
 *   <li>带 {@code tryOnly=true} 的写入不会抛异常，只在结果里返回 success=false。</li>
 * </ul>
 */
@Component
public class BlobMcpTools {

    private final StorageProvider storage;
    private final BlobStorageProperties properties;

    public BlobMcpTools(StorageProvider storage, BlobStorageProperties properties) {
        this.storage = storage;
        this.properties = properties;
    }

    @Tool(name = "blob_get_file", description = "获取文件信息（大小/扩展名/修改时间）；文件不存在时报错。")
    public StorageFileInfo getFile(
            @ToolParam(description = "文件路径（相对存储根目录，/ 分隔）") String path
    ) {
        return toFileInfo(storage.getFile(path));
    }

    @Tool(name = "blob_list_files", description = "列出目录下的直接子文件（非递归，按名称排序）；目录不存在时返回空列表。")
    public FileListResult listFiles(
            @ToolParam(required = false, description = "目录路径（为空则为根目录）") String path
    ) {
        List<StorageFileInfo> files = new ArrayList<>();
        for (StorageFile file : storage.listFiles(path)) {
            files.add(toFileInfo(file));
        }
        return new FileListResult(normalize(path), files);
    }

    @Tool(name = "blob_list_folders", description = "列出目录下的直接子目录（非递归，按名称排序）；注意：目录不存在时会被自动创建。")
    /**
     * 列出子目录。
     * <p>
     * 性能建议：{@code includeSize=true} 会递归统计每个子目录的大小，目录很大时请保持默认 false。
     */
    public FolderListResult listFolders(
            @ToolParam(required = false, description = "目录路径（为空则为根目录）") String path,
            @ToolParam(required = false, description = "是否递归统计子目录大小（默认 false）") Boolean includeSize
    ) {
        boolean withSize = Boolean.TRUE.equals(includeSize);
        List<StorageFolderInfo> folders = new ArrayList<>();
        for (StorageFolder folder : storage.listFolders(path)) {
            folders.add(new StorageFolderInfo(
                    folder.getPath(),
                    folder.getName(),
                    folder.getParent().getPath(),
                    withSize ? folder.getSize() : null,
                    folder.getLastUpdated()
            ));
        }
        return new FolderListResult(normalize(path), folders);
    }

    @Tool(name = "blob_create_folder", description = "创建目录（含中间目录）；目录已存在时报错。")
    public StorageOperationResult createFolder(
            @ToolParam(description = "目录路径") String path
    ) {
        storage.createFolder(path);
        return new StorageOperationResult("createFolder", path, null, true);
    }

    @Tool(name = "blob_try_create_folder", description = "尝试创建目录：本次创建成功返回 success=true，已存在或任何失败返回 false，不会报错。")
    public StorageOperationResult tryCreateFolder(
            @ToolParam(description = "目录路径") String path
    ) {
        return new StorageOperationResult("tryCreateFolder", path, null, storage.tryCreateFolder(path));
    }

    @Tool(name = "blob_delete_folder", description = "递归删除目录及其全部内容；目录不存在时报错。")
    public StorageOperationResult deleteFolder(
            @ToolParam(description = "目录路径") String path
    ) {
        storage.deleteFolder(path);
        return new StorageOperationResult("deleteFolder", path, null, true);
    }

    @Tool(name = "blob_rename_folder", description = "重命名/移动目录；源目录不存在或目标已存在时报错。")
    public StorageOperationResult renameFolder(
            @ToolParam(description = "源目录路径") String oldPath,
            @ToolParam(description = "目标目录路径") String newPath
    ) {
        storage.renameFolder(oldPath, newPath);
        return new StorageOperationResult("renameFolder", oldPath, newPath, true);
    }

    @Tool(name = "blob_delete_file", description = "删除文件；文件不存在时报错。")
    public StorageOperationResult deleteFile(
            @ToolParam(description = "文件路径") String path
    ) {
        storage.deleteFile(path);
        return new StorageOperationResult("deleteFile", path, null, true);
    }

    @Tool(name = "blob_rename_file", description = "重命名/移动文件；源文件不存在或目标已存在时报错。")
    public StorageOperationResult renameFile(
            @ToolParam(description = "源文件路径") String oldPath,
            @ToolParam(description = "目标文件路径") String newPath
    ) {
        storage.renameFile(oldPath, newPath);
        return new StorageOperationResult("renameFile", oldPath, newPath, true);
    }

    @Tool(name = "blob_create_file", description = "创建空文件（自动创建父目录）；文件已存在时报错。")
    public StorageFileInfo createFile(
            @ToolParam(description = "文件路径") String path
    ) {
        return toFileInfo(storage.createFile(path));
    }

    @Tool(name = "blob_create_or_replace_file", description = "创建空文件；文件已存在时先删除再创建。")
    public StorageFileInfo createOrReplaceFile(
            @ToolParam(description = "文件路径") String path
    ) {
        return toFileInfo(storage.createOrReplaceFile(path));
    }

    @Tool(name = "blob_save_content", description = "把内容保存为新文件（utf-8 文本或 base64 二进制）；默认目标已存在时报错。")
    /**
     * 保存内容。
     * <p>
     * 内容会包装成输入流后交给 {@link StorageProvider#saveStream}，与其他调用方走同一条写入路径。
     */
    public StorageOperationResult saveContent(
            @ToolParam(description = "文件路径") String path,
            @ToolParam(description = "文件内容") String content,
            @ToolParam(required = false, description = "内容编码：utf-8（默认）或 base64") String encoding,
            @ToolParam(required = false, description = "目标已存在时是否先删除（默认 false）") Boolean replaceExisting,
            @ToolParam(required = false, description = "为 true 时失败不报错，只返回 success=false（默认 false）") Boolean tryOnly
    ) {
        if (Boolean.TRUE.equals(tryOnly)) {
            boolean saved = Attempts.succeeded("saveContent", path,
                    () -> writeContent(path, content, encoding, replaceExisting));
            return new StorageOperationResult("saveContent", path, null, saved);
        }
        writeContent(path, content, encoding, replaceExisting);
        return new StorageOperationResult("saveContent", path, null, true);
    }

    private void writeContent(String path, String content, String encoding, Boolean replaceExisting) {
        byte[] bytes = decodeInputContent(content == null ? "" : content, encoding);
        if (Boolean.TRUE.equals(replaceExisting) && storage.fileExists(path)) {
            storage.deleteFile(path);
        }
        storage.saveStream(path, new ByteArrayInputStream(bytes));
    }

    @Tool(name = "blob_read_file", description = "读取文件内容（超过上限会截断）；encoding=base64 适合二进制文件。")
    public FileContentResult readFile(
            @ToolParam(description = "文件路径") String path,
            @ToolParam(required = false, description = "最多读取字节数（默认且最大为 app.storage.read-max-bytes）") Integer maxBytes,
            @ToolParam(required = false, description = "返回编码：utf-8（默认）或 base64") String encoding
    ) {
        StorageFile file = storage.getFile(path);
        int limit = resolveReadLimit(maxBytes);
        long size = file.getSize();
        byte[] bytes;
        try (InputStream in = file.openRead()) {
            bytes = in.readNBytes(limit);
        } catch (IOException e) {
            throw new InvalidStorageOperationException("readFile", path, "读取文件失败", e);
        }
        String resolvedEncoding = resolveEncoding(encoding);
        String content = "base64".equals(resolvedEncoding)
                ? Base64.getEncoder().encodeToString(bytes)
                : new String(bytes, StandardCharsets.UTF_8);
        return new FileContentResult(file.getPath(), resolvedEncoding, content, size, size > bytes.length);
    }

    @Tool(name = "blob_file_exists", description = "判断文件是否存在（路径非法时也返回 false，不会报错）。")
    public boolean fileExists(
            @ToolParam(description = "文件路径") String path
    ) {
        return storage.fileExists(path);
    }

    private int resolveReadLimit(Integer maxBytes) {
        long configured = properties.getReadMaxBytes().toBytes();
        int cap = (int) Math.min(Integer.MAX_VALUE - 8, Math.max(1, configured));
        if (maxBytes == null || maxBytes <= 0) {
            return cap;
        }
        return Math.min(maxBytes, cap);
    }

    private static StorageFileInfo toFileInfo(StorageFile file) {
        return new StorageFileInfo(
                file.getPath(),
                file.getName(),
                file.getFileType(),
                file.getSize(),
                file.getLastUpdated()
        );
    }

    private static byte[] decodeInputContent(String content, String encoding) {
        return switch (resolveEncoding(encoding)) {
            case "base64" -> {
                try {
                    yield Base64.getDecoder().decode(content);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("base64 内容不合法", e);
                }
            }
            default -> content.getBytes(StandardCharsets.UTF_8);
        };
    }

    private static String resolveEncoding(String encoding) {
        String resolved = (encoding == null || encoding.isBlank()) ? "utf-8" : encoding.trim().toLowerCase(Locale.ROOT);
        return switch (resolved) {
            case "utf-8", "utf8" -> "utf-8";
            case "base64" -> "base64";
            default -> throw new IllegalArgumentException("不支持的 encoding：" + encoding + "（请使用 utf-8 或 base64）");
        };
    }

    private static String normalize(String path) {
        return path == null ? "" : path;
    }
}
