package com.alphacheck.exception;

/**
 * A checker was asked to run without the auxiliary data or settings it needs.
 * The orchestrator reports it as an ERROR result for that checker only.
 */
public class CheckerConfigurationException extends BaseException {

    public CheckerConfigurationException(String message) {
        super(ErrorCode.CHECKER_MISCONFIGURED, message);
    }
}
