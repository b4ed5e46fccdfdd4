package org.buaa.datastd.common.web;

import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.exception.AbstractException;
import org.buaa.datastd.common.convention.result.Result;
import org.buaa.datastd.common.convention.result.Results;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * 全局异常处理器
 * 统一捕获并处理所有Controller抛出的异常
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理参数校验异常（Bean Validation）
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public Result<Void> handleValidationException(MethodArgumentNotValidException ex, HttpServletRequest request) {
        FieldError firstError = ex.getBindingResult().getFieldError();
        String errorMessage = firstError != null ? firstError.getDefaultMessage() : "参数校验失败";

        log.error("[{}] {} - 参数校验失败: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                errorMessage);

        return Results.failure(DataStdErrorCode.PARAM_INVALID.code(), errorMessage);
    }

    /**
     * 缺少必填查询参数
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public Result<Void> handleMissingParameter(MissingServletRequestParameterException ex, HttpServletRequest request) {
        log.error("[{}] {} - 缺少参数: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                ex.getParameterName());

        return Results.failure(DataStdErrorCode.PARAM_EMPTY.code(), "缺少参数: " + ex.getParameterName());
    }

    /**
     * 处理业务异常（ClientException / ServiceException）
     */
    @ExceptionHandler(AbstractException.class)
    public Result<Void> handleAbstractException(AbstractException ex, HttpServletRequest request) {
        if (ex.getCause() != null) {
            log.error("[{}] {} - 业务异常: {} ({})",
                    request.getMethod(),
                    getFullRequestUrl(request),
                    ex.getErrorMessage(),
                    ex.getErrorCode(),
                    ex);
        } else {
            log.error("[{}] {} - 业务异常: {} ({})",
                    request.getMethod(),
                    getFullRequestUrl(request),
                    ex.getErrorMessage(),
                    ex.getErrorCode());
        }

        return Results.failure(ex);
    }

    /**
     * 处理未捕获的异常（兜底处理）
     */
    @ExceptionHandler(Throwable.class)
    public Result<Void> handleThrowable(Throwable throwable, HttpServletRequest request) {
        log.error("[{}] {} - 系统异常",
                request.getMethod(),
                getFullRequestUrl(request),
                throwable);

        return Results.failure(DataStdErrorCode.SERVICE_ERROR);
    }

    private String getFullRequestUrl(HttpServletRequest request) {
        String queryString = request.getQueryString();
        return request.getRequestURI() +
                (queryString != null ? "?" + queryString : "");
    }
}
