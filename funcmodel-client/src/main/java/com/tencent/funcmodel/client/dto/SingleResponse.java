package com.tencent.funcmodel.client.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 携带单个结果对象，失败时 data 为 null
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class SingleResponse<T> extends Response {

    private T data;

    public static <T> SingleResponse<T> of(T data) {
        SingleResponse<T> response = new SingleResponse<>();
        response.setData(data);
        return response;
    }

    public static <T> SingleResponse<T> buildFailureWith(String errCode, String errMessage) {
        SingleResponse<T> response = new SingleResponse<>();
        response.markFailed(errCode, errMessage);
        return response;
    }
}
