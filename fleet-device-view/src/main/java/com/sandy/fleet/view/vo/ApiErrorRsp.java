package com.sandy.fleet.view.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiErrorRsp {
    private boolean success;
    private String code;
    private String message;

    public static ApiErrorRsp fail(String code, String message) {
        return ApiErrorRsp.builder().success(false).code(code).message(message).build();
    }
}
