package com.tencent.funcmodel.client.dto;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseTest {

    @Test
    void testFailureCarriesCodeAndMessage() {
        SingleResponse<String> response = SingleResponse.buildFailureWith("NOT_FOUND", "Function model not found: m-1");

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getData()).isNull();
        assertThat(response.hasErrCode("NOT_FOUND")).isTrue();
        assertThat(response.hasErrCode("CONFLICT")).isFalse();
        assertThat(response.getErrMessage()).isEqualTo("Function model not found: m-1");
    }

    @Test
    void testSuccessHasNoErrCode() {
        Response response = Response.buildSuccess();

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getErrCode()).isNull();
        assertThat(response.hasErrCode(null)).isFalse();
        assertThat(SingleResponse.of("m-1").getData()).isEqualTo("m-1");
    }

    @Test
    void testMultiResponseCopiesItsData() {
        List<String> ids = Arrays.asList("a", "b");

        MultiResponse<String> response = MultiResponse.of(ids);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData()).containsExactly("a", "b").isNotSameAs(ids);
        assertThat(MultiResponse.<String>of(null).size()).isZero();
        assertThat(MultiResponse.<String>buildFailureWith("CONFLICT", "busy").hasErrCode("CONFLICT")).isTrue();
    }
}
