package org.buaa.datastd.common.convention.exception;

import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.errorcode.IErrorCode;

import java.util.Optional;

/**
 * 服务端异常
 * 用于表示由服务端内部错误引起的问题（如数据库异常、向量库或向量模型调用失败等）
 */
public class ServiceException extends AbstractException {

    public ServiceException(IErrorCode errorCode) {
        this(null, null, errorCode);
    }

    public ServiceException(String message) {
        this(message, null, DataStdErrorCode.SERVICE_ERROR);
    }

    public ServiceException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    public ServiceException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
