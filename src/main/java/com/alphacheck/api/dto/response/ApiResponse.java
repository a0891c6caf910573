package com.alphacheck.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope for every {@code /api} body. {@code path} is the request path, matching
 * the field of the same name in {@link ApiErrorResponse}.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final String path;
    private final Instant timestamp;

    private ApiResponse(T data, String path) {
        this.data = data;
        this.path = path;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data, String path) {
        return new ApiResponse<>(data, path);
    }
}
