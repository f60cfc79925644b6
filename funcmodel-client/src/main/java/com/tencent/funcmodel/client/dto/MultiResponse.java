package com.tencent.funcmodel.client.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 携带结果列表，data 始终不为 null
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class MultiResponse<T> extends Response {

    private List<T> data = new ArrayList<>();

    public static <T> MultiResponse<T> of(Collection<T> data) {
        MultiResponse<T> response = new MultiResponse<>();
        if (data != null) {
            response.setData(new ArrayList<>(data));
        }
        return response;
    }

    public static <T> MultiResponse<T> buildFailureWith(String errCode, String errMessage) {
        MultiResponse<T> response = new MultiResponse<>();
        response.markFailed(errCode, errMessage);
        return response;
    }

    public int size() {
        return data == null ? 0 : data.size();
    }
}
