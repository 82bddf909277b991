package com.fintech.checkout.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response envelope shared by the payment endpoints:
 * {@code {success, data, message}} or {@code {success:false, error, details?, missingFields?}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResult<T> {

    private boolean success;
    private T data;
    private String message;
    private String error;
    private Object details;
    private List<String> missingFields;

    public static <T> ApiResult<T> ok(T data) {
        return ApiResult.<T>builder()
                .success(true)
                .data(data)
                .build();
    }

    public static <T> ApiResult<T> ok(T data, String message) {
        return ApiResult.<T>builder()
                .success(true)
                .data(data)
                .message(message)
                .build();
    }

    public static <T> ApiResult<T> failure(String error, Object details) {
        return ApiResult.<T>builder()
                .success(false)
                .error(error)
                .details(details)
                .build();
    }
}
