package com.kensa.common.exception;

/**
 * 外部分类模型调用异常。
 * <p>
 * 不允许用默认分数替代，必须原样抛给调用方。
 */
public class ClassifierException extends KensaException {

    public static final String CODE = "CLASSIFIER_ERROR";

    public ClassifierException(String message) {
        super(CODE, message);
    }

    public ClassifierException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
