package com.wangbin.hoststats.common.exception;

import com.wangbin.hoststats.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 资源不存在异常
 */
@Getter
public class ResourceNotFoundException extends BusinessException {

    private final String resourceId;

    public ResourceNotFoundException(ResultCode resultCode, String resourceId) {
        super(resultCode, resourceId);
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException agentNotFound(String agentId) {
        return new ResourceNotFoundException(ResultCode.AGENT_NOT_FOUND, agentId);
    }
}
