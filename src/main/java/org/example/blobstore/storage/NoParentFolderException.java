package org.example.blobstore.storage;

public class NoParentFolderException extends StorageException {

    public NoParentFolderException(String path) {
        super("getParent", path, "根目录没有父目录");
    }
}
