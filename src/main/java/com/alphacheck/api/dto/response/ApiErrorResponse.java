package com.alphacheck.api.dto.response;

import com.alphacheck.exception.BaseException;
import com.alphacheck.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope written by the global exception handler.
 *
 * <p>{@code details} carries the structured context of a {@link BaseException}, e.g. the
 * missing tables of an incomplete dataset or the file and missing columns of a malformed
 * event file. It is omitted when there is none.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(BaseException ex, String path) {
        return of(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), path);
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details)
                .path(path)
                .timestamp(Instant.now())
                .build());
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final int status;
        private final String message;

        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private final Map<String, Object> details;

        private final String path;
        private final Instant timestamp;
    }
}
