package yggdrasil.storage.common.convention.exception;

import yggdrasil.storage.common.convention.errorcode.IErrorCode;

/**
 * 摄取输入校验失败
 * 在任何写入之前同步抛给调用方，不可重试
 */
public class ContentValidationException extends ClientException {

    public ContentValidationException(IErrorCode errorCode) {
        super(errorCode);
    }

    public ContentValidationException(String message, IErrorCode errorCode) {
        super(message, errorCode);
    }
}
