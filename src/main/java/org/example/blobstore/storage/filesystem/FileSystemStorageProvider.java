package org.example.blobstore.storage.filesystem;

import org.example.blobstore.storage.Attempts;
import org.example.blobstore.storage.InvalidStorageOperationException;
import org.example.blobstore.storage.InvalidStoragePathException;
import org.example.blobstore.storage.StorageAlreadyExistsException;
import org.example.blobstore.storage.StorageFile;
import org.example.blobstore.storage.StorageFolder;
import org.example.blobstore.storage.StorageNotFoundException;
import org.example.blobstore.storage.StorageProvider;
import org.example.blobstore.storage.filesystem.StoragePathResolver.ResolvedPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * 基于本地文件系统的 {@link StorageProvider}：所有相对路径都映射到固定根目录之下。
 * <p>
 * 每个操作都先通过 {@link StoragePathResolver} 解析路径（越界直接拒绝，不会产生任何副作用），
 * 再委托给 {@link Files} 完成实际 IO。底层 {@link IOException} 统一包装成
 * {@link InvalidStorageOperationException}，并保留原始 cause。
 * <p>
 * 不做任何缓存或加锁：对同一路径的并发调用由文件系统自身的原子性决定结果。
 */
public class FileSystemStorageProvider implements StorageProvider {

    private static final Logger log = LoggerFactory.getLogger(FileSystemStorageProvider.class);

    public static final int DEFAULT_COPY_BUFFER_SIZE = 8192;

    private final StoragePathResolver resolver;
    private final int copyBufferSize;
    private volatile Instant defaultSharedAccessExpiration;

    public FileSystemStorageProvider(Path root) {
        this(new StoragePathResolver(root, PathCaseSensitivity.AUTO), DEFAULT_COPY_BUFFER_SIZE);
    }

    public FileSystemStorageProvider(StoragePathResolver resolver, int copyBufferSize) {
        if (copyBufferSize <= 0) {
            throw new IllegalArgumentException("copyBufferSize 必须大于 0：" + copyBufferSize);
        }
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.copyBufferSize = copyBufferSize;
    }

    public Path getRoot() {
        return resolver.getRoot();
    }

    @Override
    public StorageFile getFile(String path) {
        ResolvedPath resolved = resolver.resolve("getFile", path);
        if (!Files.isRegularFile(resolved.absolutePath())) {
            throw StorageNotFoundException.file("getFile", path);
        }
        return new FileSystemFile(resolved.relativePath(), resolved.absolutePath());
    }

    @Override
    public List<StorageFile> listFiles(String path) {
        ResolvedPath resolved = resolver.resolve("listFiles", path);
        if (!Files.isDirectory(resolved.absolutePath())) {
            return List.of();
        }
        List<StorageFile> files = new ArrayList<>();
        for (Path child : listChildren("listFiles", path, resolved.absolutePath(), Files::isRegularFile)) {
            String childPath = childPath(resolved, child);
            if (staysInRoot("listFiles", childPath)) {
                files.add(new FileSystemFile(childPath, child));
            }
        }
        return files;
    }

    @Override
    public List<StorageFolder> listFolders(String path) {
        ResolvedPath resolved = resolver.resolve("listFolders", path);
        Path directory = resolved.absolutePath();
        if (!Files.isDirectory(directory)) {
            // 目录不存在时自动创建（保留的历史行为）
            try {
                Files.createDirectories(directory);
                log.debug("listFolders 自动创建目录：{}", resolved.relativePath());
            } catch (IOException e) {
                throw new InvalidStorageOperationException("listFolders", path, "目录无法创建", e);
            }
        }
        List<StorageFolder> folders = new ArrayList<>();
        for (Path child : listChildren("listFolders", path, directory, Files::isDirectory)) {
            String childPath = childPath(resolved, child);
            if (staysInRoot("listFolders", childPath)) {
                folders.add(new FileSystemFolder(childPath, child));
            }
        }
        return folders;
    }

    @Override
    public boolean tryCreateFolder(String path) {
        return Attempts.holds("tryCreateFolder", path, () -> {
            ResolvedPath resolved = resolver.resolve("tryCreateFolder", path);
            if (Files.exists(resolved.absolutePath())) {
                return false;
            }
            createFolder(path);
            return true;
        });
    }

    @Override
    public void createFolder(String path) {
        ResolvedPath resolved = resolver.resolve("createFolder", path);
        Path directory = resolved.absolutePath();
        if (Files.isDirectory(directory)) {
            throw StorageAlreadyExistsException.folder("createFolder", path);
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new InvalidStorageOperationException("createFolder", path, "目录创建失败", e);
        }
        log.debug("创建目录：{}", resolved.relativePath());
    }

    @Override
    public void deleteFolder(String path) {
        ResolvedPath resolved = resolver.resolve("deleteFolder", path);
        Path directory = resolved.absolutePath();
        if (!Files.isDirectory(directory)) {
            throw StorageNotFoundException.folder("deleteFolder", path);
        }
        try {
            deleteRecursively(directory);
        } catch (IOException e) {
            throw new InvalidStorageOperationException("deleteFolder", path, "目录删除失败", e);
        }
        log.debug("删除目录：{}", resolved.relativePath());
    }

    @Override
    public void renameFolder(String oldPath, String newPath) {
        // 两个路径都先解析，目标越界时源目录保持不变
        ResolvedPath source = resolver.resolve("renameFolder", oldPath);
        ResolvedPath target = resolver.resolve("renameFolder", newPath);
        if (!Files.isDirectory(source.absolutePath())) {
            throw StorageNotFoundException.folder("renameFolder", oldPath);
        }
        if (Files.exists(target.absolutePath(), LinkOption.NOFOLLOW_LINKS)) {
            throw StorageAlreadyExistsException.folder("renameFolder", newPath);
        }
        move("renameFolder", newPath, source.absolutePath(), target.absolutePath());
        log.debug("重命名目录：{} -> {}", source.relativePath(), target.relativePath());
    }

    @Override
    public void deleteFile(String path) {
        ResolvedPath resolved = resolver.resolve("deleteFile", path);
        Path file = resolved.absolutePath();
        if (!Files.isRegularFile(file)) {
            throw StorageNotFoundException.file("deleteFile", path);
        }
        try {
            Files.delete(file);
        } catch (IOException e) {
            throw new InvalidStorageOperationException("deleteFile", path, "文件删除失败", e);
        }
        log.debug("删除文件：{}", resolved.relativePath());
    }

    @Override
    public void renameFile(String oldPath, String newPath) {
        ResolvedPath source = resolver.resolve("renameFile", oldPath);
        ResolvedPath target = resolver.resolve("renameFile", newPath);
        if (!Files.isRegularFile(source.absolutePath())) {
            throw StorageNotFoundException.file("renameFile", oldPath);
        }
        if (Files.exists(target.absolutePath(), LinkOption.NOFOLLOW_LINKS)) {
            throw StorageAlreadyExistsException.file("renameFile", newPath);
        }
        move("renameFile", newPath, source.absolutePath(), target.absolutePath());
        log.debug("重命名文件：{} -> {}", source.relativePath(), target.relativePath());
    }

    @Override
    public StorageFile createFile(String path) {
        return createEmptyFile("createFile", path);
    }

    @Override
    public void saveStream(String path, InputStream inputStream) {
        Objects.requireNonNull(inputStream, "inputStream");
        FileSystemFile file = createEmptyFile("saveStream", path);

        // 固定大小的缓冲区循环拷贝，内存占用与文件大小无关；输入流归调用方所有，这里不关闭
        byte[] buffer = new byte[copyBufferSize];
        long total = 0;
        try (OutputStream out = Files.newOutputStream(file.physicalPath(), StandardOpenOption.WRITE)) {
            int read;
            while ((read = inputStream.read(buffer)) >= 0) {
                out.write(buffer, 0, read);
                total += read;
            }
        } catch (IOException e) {
            throw new InvalidStorageOperationException("saveStream", path, "写入文件失败", e);
        }
        log.debug("保存文件：{}（{} 字节）", file.getPath(), total);
    }

    @Override
    public boolean fileExists(String path) {
        return Attempts.holds("fileExists", path,
                () -> Files.isRegularFile(resolver.resolve("fileExists", path).absolutePath()));
    }

    @Override
    public Instant getDefaultSharedAccessExpiration() {
        return defaultSharedAccessExpiration;
    }

    @Override
    public void setDefaultSharedAccessExpiration(Instant expiration) {
        this.defaultSharedAccessExpiration = expiration;
    }

    private FileSystemFile createEmptyFile(String operation, String path) {
        ResolvedPath resolved = resolver.resolve(operation, path);
        Path file = resolved.absolutePath();
        if (Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            throw StorageAlreadyExistsException.file(operation, path);
        }
        Path parent = file.getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new InvalidStorageOperationException(operation, path, "父目录创建失败", e);
            }
        }
        try {
            Files.createFile(file);
        } catch (FileAlreadyExistsException e) {
            // 检查之后被并发创建
            throw StorageAlreadyExistsException.file(operation, path);
        } catch (IOException e) {
            throw new InvalidStorageOperationException(operation, path, "文件创建失败", e);
        }
        log.debug("创建文件：{}", resolved.relativePath());
        return new FileSystemFile(resolved.relativePath(), file);
    }

    /**
     * 列表中的子项同样要经过根目录包含性校验：指向根目录之外的符号链接不会作为条目返回。
     */
    private boolean staysInRoot(String operation, String childPath) {
        try {
            resolver.resolve(operation, childPath);
            return true;
        } catch (InvalidStoragePathException e) {
            log.debug("{} 跳过逃逸出根目录的条目：{}", operation, childPath);
            return false;
        }
    }

    private static List<Path> listChildren(String operation, String path, Path directory, Predicate<Path> filter) {
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path child : stream) {
                if (filter.test(child)) {
                    children.add(child);
                }
            }
        } catch (IOException e) {
            throw new InvalidStorageOperationException(operation, path, "列出目录失败", e);
        }
        children.sort(Comparator.comparing((Path p) -> p.getFileName().toString()));
        return children;
    }

    private static String childPath(ResolvedPath parent, Path child) {
        String name = child.getFileName().toString();
        return parent.isRoot() ? name : parent.relativePath() + "/" + name;
    }

    private static void move(String operation, String targetPath, Path source, Path target) {
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try {
                Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(source, target);
            }
        } catch (FileAlreadyExistsException e) {
            throw new StorageAlreadyExistsException(operation, targetPath, "目标已存在：" + targetPath);
        } catch (IOException e) {
            throw new InvalidStorageOperationException(operation, targetPath, "移动失败", e);
        }
    }

    private static void deleteRecursively(Path directory) throws IOException {
        // 不跟随符号链接：链接本身被删除，链接指向的内容不受影响
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
