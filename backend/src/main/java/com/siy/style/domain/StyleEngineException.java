package com.siy.style.domain;

public class StyleEngineException extends RuntimeException {

    private final StyleErrorCode errorCode;

    public StyleEngineException(StyleErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public StyleEngineException(StyleErrorCode errorCode, String detail) {
        super(errorCode.getMessage() + ": " + detail);
        this.errorCode = errorCode;
    }

    public StyleErrorCode errorCode() {
        return errorCode;
    }
}
