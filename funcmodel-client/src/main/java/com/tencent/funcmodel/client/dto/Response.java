package com.tencent.funcmodel.client.dto;

import lombok.Data;

import java.io.Serializable;

/**
 * Response - 应用服务的统一返回
 * <p>
 * 失败时 errCode 为 VALIDATION_ERROR、NOT_FOUND、CONFLICT、ACCESS_DENIED 或 INTERNAL_ERROR，
 * errMessage 为领域层给出的原始错误信息。
 * </p>
 */
@Data
public class Response implements Serializable {

    private static final long serialVersionUID = 1L;

    private boolean success = true;

    private String errCode;

    private String errMessage;

    public static Response buildSuccess() {
        return new Response();
    }

    public static Response buildFailure(String errCode, String errMessage) {
        Response response = new Response();
        response.markFailed(errCode, errMessage);
        return response;
    }

    /**
     * 失败且错误码等于 code
     */
    public boolean hasErrCode(String code) {
        return !success && code != null && code.equals(errCode);
    }

    protected void markFailed(String errCode, String errMessage) {
        this.success = false;
        this.errCode = errCode;
        this.errMessage = errMessage;
    }
}
