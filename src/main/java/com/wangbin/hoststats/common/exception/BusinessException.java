package com.wangbin.hoststats.common.exception;

import com.wangbin.hoststats.common.web.result.ResultCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 业务异常，平台所有可识别错误的基类
 */
@Data
@EqualsAndHashCode(callSuper = false)
public class BusinessException extends RuntimeException {

    private final int code;
    private final String message;
    private final String detail;

    public BusinessException(ResultCode resultCode) {
        this(resultCode, null);
    }

    public BusinessException(ResultCode resultCode, String detail) {
        super(compose(resultCode, detail));
        this.code = resultCode.getCode();
        this.message = compose(resultCode, detail);
        this.detail = detail;
    }

    public BusinessException(ResultCode resultCode, String detail, Throwable cause) {
        this(resultCode, detail);
        initCause(cause);
    }

    /**
     * 获取对应的响应码
     */
    public ResultCode getResultCode() {
        return ResultCode.fromCode(code);
    }

    private static String compose(ResultCode resultCode, String detail) {
        if (detail == null || detail.isEmpty()) {
            return resultCode.getMessage();
        }
        return resultCode.getMessage() + ": " + detail;
    }
}
