package org.example.blobstore.storage;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Instant;

/**
 * 存储中的文件（只读视图）。
 * <p>
 * 每次调用访问器都会重新读取底层存储的当前状态，不做缓存；
 * 通过 {@link StorageProvider} 修改后，旧对象的返回值可能随之变化，也可能因文件被删除而失败。
 */
public interface StorageFile {

    /**
     * 相对存储根目录的路径（统一使用 / 分隔）。
     */
    String getPath();

    String getName();

    long getSize();

    Instant getLastUpdated();

    /**
     * 扩展名（包含点，例如 {@code .txt}）；没有扩展名时返回空字符串。
     */
    String getFileType();

    InputStream openRead();

    /**
     * 打开写入流（从文件开头覆盖写，不截断剩余内容）。
     */
    OutputStream openWrite();

    /**
     * 打开写入流并先把文件截断为 0 字节。
     */
    OutputStream createFile();
}
