package org.example.blobstore.storage.filesystem;

import java.util.Locale;

/**
 * 根目录包含性校验时，路径段比较是否区分大小写。
 */
public enum PathCaseSensitivity {

    /**
     * 按宿主系统决定：Windows / macOS 默认文件系统不区分大小写，其余系统区分。
     */
    AUTO,
    SENSITIVE,
    INSENSITIVE;

    public boolean isCaseInsensitive() {
        return switch (this) {
            case SENSITIVE -> false;
            case INSENSITIVE -> true;
            case AUTO -> hostIsCaseInsensitive(System.getProperty("os.name", ""));
        };
    }

    static boolean hostIsCaseInsensitive(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        return os.startsWith("windows") || os.startsWith("mac");
    }
}
