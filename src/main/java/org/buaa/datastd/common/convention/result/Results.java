package org.buaa.datastd.common.convention.result;

import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.errorcode.IErrorCode;
import org.buaa.datastd.common.convention.exception.AbstractException;

import java.util.Optional;

/**
 * 返回对象构造工具类
 */
public final class Results {

    private Results() {
    }

    /**
     * 构造成功响应（无数据）
     */
    public static Result<Void> success() {
        return new Result<Void>()
                .setCode(DataStdErrorCode.SUCCESS.code())
                .setMessage(DataStdErrorCode.SUCCESS.message());
    }

    /**
     * 构造成功响应（带数据）
     */
    public static <T> Result<T> success(T data) {
        return new Result<T>()
                .setCode(DataStdErrorCode.SUCCESS.code())
                .setMessage(DataStdErrorCode.SUCCESS.message())
                .setData(data);
    }

    /**
     * 构造失败响应（从业务异常）
     */
    public static Result<Void> failure(AbstractException exception) {
        return new Result<Void>()
                .setCode(Optional.ofNullable(exception.getErrorCode())
                        .orElse(DataStdErrorCode.SERVICE_ERROR.code()))
                .setMessage(Optional.ofNullable(exception.getErrorMessage())
                        .orElse(DataStdErrorCode.SERVICE_ERROR.message()));
    }

    public static Result<Void> failure(String errorCode, String errorMessage) {
        return new Result<Void>()
                .setCode(errorCode)
                .setMessage(errorMessage);
    }

    public static Result<Void> failure(IErrorCode errorCode) {
        return new Result<Void>()
                .setCode(errorCode.code())
                .setMessage(errorCode.message());
    }
}
