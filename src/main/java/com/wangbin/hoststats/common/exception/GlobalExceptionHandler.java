package com.wangbin.hoststats.common.exception;

import com.wangbin.hoststats.common.web.result.ApiResult;
import com.wangbin.hoststats.common.web.result.ResultCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public ApiResult<?> handleBusinessException(BusinessException e, HttpServletRequest request) {
        if (e.getResultCode().isInternalError()) {
            log.error("内部错误: {} - {}", e.getCode(), e.getMessage(), e);
        } else {
            log.warn("业务异常: {} - {}, 请求地址: {}", e.getCode(), e.getMessage(), request.getRequestURI());
        }
        ApiResult<Object> result = ApiResult.error(e.getCode(), e.getMessage());
        if (e.getDetail() != null) {
            result.addExtra("detail", e.getDetail());
        }
        return result;
    }

    /**
     * 处理参数类型异常（如日期格式）
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ApiResult<?> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        String message = e.getName() + ": " + e.getValue();
        log.warn("参数类型错误: {}", message);
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), message);
    }

    /**
     * 处理约束违反异常
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ApiResult<?> handleConstraintViolationException(ConstraintViolationException e) {
        String message = e.getConstraintViolations().stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .collect(Collectors.joining("; "));

        log.warn("约束违反异常: {}", message);
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), message);
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    public ApiResult<?> handleException(Exception e, HttpServletRequest request) {
        log.error("请求地址: {}, 请求方法: {}, 异常信息: {}",
                request.getRequestURI(), request.getMethod(), e.getMessage(), e);
        return ApiResult.error(ResultCode.SYSTEM_ERROR);
    }
}
