package com.alphacheck.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    DATA_CONTRACT_VIOLATION("DATA_CONTRACT_VIOLATION", 422),
    CHECKER_MISCONFIGURED("CHECKER_MISCONFIGURED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
