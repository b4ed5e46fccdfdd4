package org.buaa.datastd.common.convention.exception;

import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.errorcode.IErrorCode;

import java.util.Optional;

/**
 * 客户端异常
 * 用于表示由客户端请求引起的错误（如参数校验失败、资源不存在、名称重复等）
 */
public class ClientException extends AbstractException {

    public ClientException(IErrorCode errorCode) {
        this(null, null, errorCode);
    }

    public ClientException(String message) {
        this(message, null, DataStdErrorCode.CLIENT_ERROR);
    }

    public ClientException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    /**
     * 完整构造器
     *
     * @param message 自定义错误消息
     * @param throwable 原始异常
     * @param errorCode 错误码
     */
    public ClientException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
