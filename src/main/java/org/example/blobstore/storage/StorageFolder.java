package org.example.blobstore.storage;

import java.time.Instant;

/**
 * 存储中的目录（只读视图），与 {@link StorageFile} 一样每次调用都重新读取底层状态。
 */
public interface StorageFolder {

    String getPath();

    String getName();

    Instant getLastUpdated();

    /**
     * 目录下所有普通文件大小之和（递归）。
     */
    long getSize();

    /**
     * @throws NoParentFolderException 当前目录就是存储根目录
     */
    StorageFolder getParent();
}
