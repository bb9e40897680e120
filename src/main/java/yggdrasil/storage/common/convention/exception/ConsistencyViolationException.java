package yggdrasil.storage.common.convention.exception;

import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;

/**
 * 迁移回读校验失败
 * 迁移中止且原指针保留，需人工复核，不会自动重试
 */
public class ConsistencyViolationException extends ServiceException {

    public ConsistencyViolationException(String message) {
        super(message, StorageErrorCode.CONSISTENCY_VIOLATION);
    }
}
