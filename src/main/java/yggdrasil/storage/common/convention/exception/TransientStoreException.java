package yggdrasil.storage.common.convention.exception;

import yggdrasil.storage.common.convention.errorcode.IErrorCode;

/**
 * 外部存储的瞬时故障（超时、网络错误）
 * 按指数退避重试，重试耗尽后记录降级，不再抛回摄取调用方
 */
public class TransientStoreException extends ServiceException {

    public TransientStoreException(String message, IErrorCode errorCode) {
        super(message, errorCode);
    }

    public TransientStoreException(String message, Throwable throwable, IErrorCode errorCode) {
        super(message, throwable, errorCode);
    }
}
