package org.example.blobstore.storage.filesystem;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * 文件系统存储的配置（{@code app.storage.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #root} 是存储根目录，启动时确定，运行期间不可修改；所有相对路径都只能落在它之内。</li>
 *   <li>{@link #copyBufferSize} 决定保存流时的内存占用上限（与文件大小无关）。</li>
 *   <li>{@link #pathCaseSensitivity} 决定根目录包含性校验是否区分大小写。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.storage")
public class BlobStorageProperties {

    static final DataSize MAX_COPY_BUFFER_SIZE = DataSize.ofMegabytes(16);

    /**
     * 存储根目录（相对路径按工作目录解析为绝对路径）。
     */
    @NotBlank
    private String root = "./storage";

    /**
     * 保存流时的拷贝缓冲区大小（1 字节 ~ 16MB）。
     */
    @NotNull
    private DataSize copyBufferSize = DataSize.ofKilobytes(8);

    /**
     * {@code blob_read_file} 读取文件的最大字节数（超过则截断）。
     */
    @NotNull
    private DataSize readMaxBytes = DataSize.ofMegabytes(1);

    /**
     * 包含性校验的大小写策略。
     * <p>
     * 默认 AUTO：Windows/macOS 不区分大小写，其余系统区分。
     */
    @NotNull
    private PathCaseSensitivity pathCaseSensitivity = PathCaseSensitivity.AUTO;

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public DataSize getCopyBufferSize() {
        return copyBufferSize;
    }

    public void setCopyBufferSize(DataSize copyBufferSize) {
        this.copyBufferSize = copyBufferSize;
    }

    public DataSize getReadMaxBytes() {
        return readMaxBytes;
    }

    public void setReadMaxBytes(DataSize readMaxBytes) {
        this.readMaxBytes = readMaxBytes;
    }

    public PathCaseSensitivity getPathCaseSensitivity() {
        return pathCaseSensitivity;
    }

    public void setPathCaseSensitivity(PathCaseSensitivity pathCaseSensitivity) {
        this.pathCaseSensitivity = pathCaseSensitivity;
    }
}
