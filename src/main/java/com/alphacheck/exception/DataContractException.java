package com.alphacheck.exception;

import java.util.Map;

/**
 * Input data does not satisfy the loader's contract: a required table or column is
 * missing, or a cell cannot be coerced to its type. Always raised before any checker runs.
 */
public class DataContractException extends BaseException {

    public DataContractException(String message) {
        super(ErrorCode.DATA_CONTRACT_VIOLATION, message);
    }

    public DataContractException(String message, Map<String, Object> details) {
        super(ErrorCode.DATA_CONTRACT_VIOLATION, message, details);
    }

    public DataContractException(String message, Throwable cause) {
        super(ErrorCode.DATA_CONTRACT_VIOLATION, message, cause);
    }
}
