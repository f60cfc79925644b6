package com.tencent.funcmodel.app.assembler;

import com.tencent.funcmodel.client.dto.Response;
import com.tencent.funcmodel.client.dto.SingleResponse;
import com.tencent.funcmodel.domain.shared.ErrorType;
import com.tencent.funcmodel.domain.shared.Result;

import java.util.function.Function;

/**
 * {@link Result} -> client Response，错误码取 {@link ErrorType#getCode()}
 */
public final class ResponseAssembler {

    private ResponseAssembler() {
    }

    public static Response toResponse(Result<?> result) {
        if (result.isFailure()) {
            return Response.buildFailure(errorCode(result), result.getError());
        }
        return Response.buildSuccess();
    }

    public static <T, R> SingleResponse<R> toSingle(Result<T> result, Function<? super T, ? extends R> mapper) {
        if (result.isFailure()) {
            return SingleResponse.buildFailureWith(errorCode(result), result.getError());
        }
        return SingleResponse.of(mapper.apply(result.getValue()));
    }

    private static String errorCode(Result<?> result) {
        ErrorType type = result.getErrorType() == null ? ErrorType.INTERNAL : result.getErrorType();
        return type.getCode();
    }
}
