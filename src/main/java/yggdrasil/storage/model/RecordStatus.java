package yggdrasil.storage.model;

/**
 * 内容记录状态
 */
public enum RecordStatus {

    /** 记录已创建，分支仍在写入，指针为空 */
    PENDING,

    /** 指针指向的位置均已完整写入且可读 */
    READY,

    /** 部分分支写入失败，可读但不完整 */
    DEGRADED,

    /** 正在迁移到新策略，原指针仍然有效 */
    MIGRATING
}
