package com.chesshub.web.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApiResponseTest {

    @Test
    void successCarriesData() {
        ApiResponse<String> r = ApiResponse.success("room-1");

        assertThat(r.code()).isEqualTo(200);
        assertThat(r.message()).isEqualTo(ApiResponse.OK);
        assertThat(r.data()).isEqualTo("room-1");
    }

    @Test
    void errorFactoriesUseHttpCodes() {
        assertThat(ApiResponse.badRequest("bad").code()).isEqualTo(400);
        assertThat(ApiResponse.unauthorized("no").code()).isEqualTo(401);
        assertThat(ApiResponse.notFound("none").code()).isEqualTo(404);
        assertThat(ApiResponse.conflict("taken").code()).isEqualTo(409);
        assertThat(ApiResponse.conflict("taken").message()).isEqualTo("taken");
        assertThat(ApiResponse.conflict("taken").data()).isNull();
    }
}
