package org.example.blobstore.storage.filesystem;

import org.example.blobstore.storage.InvalidStoragePathException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 存储路径解析器：把调用方传入的相对路径映射成根目录下的绝对路径，并确保它不会逃逸出根目录。
 * <p>
 * 解析步骤：
 * <ol>
 *   <li>空路径表示根目录；否则把 / 转换成宿主分隔符后拼接到根目录上。</li>
 *   <li>对候选路径和根目录分别做规范化：去掉 {@code .}/{@code ..}，并把已存在的最深一级祖先替换为 realPath
 *   （解析符号链接/junction）。</li>
 *   <li>逐段比较：规范化后的候选路径必须等于根目录或位于根目录之下，否则抛出 {@link InvalidStoragePathException}。</li>
 * </ol>
 * <p>
 * 注意：
 * <ul>
 *   <li>这是安全边界：越界路径只会被拒绝，绝不会被“裁剪”回根目录。</li>
 *   <li>解析过程中的任何异常（非法字符、链接无法解析等）都视为越界。</li>
 *   <li>解析器本身不会创建/修改任何文件，只会为解析链接而读取文件系统。</li>
 * </ul>
 */
public class StoragePathResolver {

    private static final Logger log = LoggerFactory.getLogger(StoragePathResolver.class);

    private static final String SEPARATOR = FileSystems.getDefault().getSeparator();

    private final Path root;
    private final boolean caseInsensitive;

    public StoragePathResolver(Path root, PathCaseSensitivity caseSensitivity) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.caseInsensitive = Objects.requireNonNull(caseSensitivity, "caseSensitivity").isCaseInsensitive();
    }

    public Path getRoot() {
        return root;
    }

    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    /**
     * 解析相对路径。
     *
     * @param operation    调用方操作名（用于异常信息）
     * @param relativePath 以 / 分隔的相对路径；{@code null} 或空字符串表示根目录
     * @throws InvalidStoragePathException 路径越界或无法解析
     */
    public ResolvedPath resolve(String operation, String relativePath) {
        Path candidate;
        Path canonicalRoot;
        Path canonicalCandidate;
        try {
            candidate = (relativePath == null || relativePath.isEmpty())
                    ? root
                    : root.resolve(relativePath.replace("/", SEPARATOR)).normalize();
            canonicalRoot = canonicalize(root);
            canonicalCandidate = canonicalize(candidate);
        } catch (IOException | RuntimeException e) {
            log.warn("{} 拒绝无法解析的路径：{}（{}）", operation, relativePath, e.toString());
            throw new InvalidStoragePathException(operation, relativePath, e);
        }

        if (!isWithin(canonicalRoot, canonicalCandidate)) {
            log.warn("{} 拒绝越界路径：{}", operation, relativePath);
            throw new InvalidStoragePathException(operation, relativePath);
        }

        // 大小写不敏感时，字面路径可能与根目录大小写不一致（例如 ../ROOT/x），此时以规范化结果的剩余段为准
        Path relative = candidate.startsWith(root)
                ? root.relativize(candidate)
                : relativeSegments(canonicalRoot, canonicalCandidate);
        String display = relative.toString().replace(SEPARATOR, "/");
        return new ResolvedPath(display, display.isEmpty() ? root : root.resolve(relative));
    }

    /**
     * 规范化路径：绝对化 + 去掉 {@code .}/{@code ..}，再把已存在的最深祖先替换为 realPath，剩余（尚不存在的）部分原样拼回。
     * <p>
     * 祖先链路按 NOFOLLOW_LINKS 判断是否存在，因此悬空链接会在 toRealPath 时失败并被拒绝。
     */
    static Path canonicalize(Path path) throws IOException {
        Path normalized = path.toAbsolutePath().normalize();
        Path existing = normalized;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return normalized;
        }
        Path real = existing.toRealPath();
        return real.resolve(existing.relativize(normalized)).normalize();
    }

    private boolean isWithin(Path canonicalRoot, Path canonicalCandidate) {
        // 逐段比较而不是字符串前缀，避免 /data 误包含 /database
        if (canonicalCandidate.getNameCount() < canonicalRoot.getNameCount()) {
            return false;
        }
        if (!sameSegment(String.valueOf(canonicalRoot.getRoot()), String.valueOf(canonicalCandidate.getRoot()))) {
            return false;
        }
        for (int i = 0; i < canonicalRoot.getNameCount(); i++) {
            if (!sameSegment(canonicalRoot.getName(i).toString(), canonicalCandidate.getName(i).toString())) {
                return false;
            }
        }
        return true;
    }

    private boolean sameSegment(String a, String b) {
        return caseInsensitive ? a.equalsIgnoreCase(b) : a.equals(b);
    }

    private static Path relativeSegments(Path canonicalRoot, Path canonicalCandidate) {
        int from = canonicalRoot.getNameCount();
        int to = canonicalCandidate.getNameCount();
        return from == to ? Path.of("") : canonicalCandidate.subpath(from, to);
    }

    /**
     * @param relativePath 规范化后的相对路径（/ 分隔，根目录为空字符串）
     * @param absolutePath 根目录下的绝对路径（未解析链接）
     */
    public record ResolvedPath(String relativePath, Path absolutePath) {

        public boolean isRoot() {
            return relativePath.isEmpty();
        }
    }
}
