package yggdrasil.storage.common.convention.exception;

import yggdrasil.storage.common.convention.errorcode.IErrorCode;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;

import java.util.Optional;

/**
 * 调用方异常
 * 由调用方输入或调用时机引起，不可重试
 */
public class ClientException extends AbstractException {

    public ClientException(IErrorCode errorCode) {
        this(null, null, errorCode);
    }

    public ClientException(String message) {
        this(message, null, StorageErrorCode.CLIENT_ERROR);
    }

    public ClientException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    public ClientException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
