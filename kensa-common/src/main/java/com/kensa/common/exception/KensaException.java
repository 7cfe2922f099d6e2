package com.kensa.common.exception;

/**
 * 系统基础异常，所有业务异常的父类。
 */
public class KensaException extends RuntimeException {

    private final String errorCode;

    public KensaException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public KensaException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
