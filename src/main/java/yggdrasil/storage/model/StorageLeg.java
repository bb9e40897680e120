package yggdrasil.storage.model;

/**
 * 一次写入涉及的存储分支
 */
public enum StorageLeg {
    FULL,
    VECTOR,
    SPECIALIZED
}
