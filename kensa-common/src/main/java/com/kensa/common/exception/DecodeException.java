package com.kensa.common.exception;

/**
 * 图片解码异常（字节流无法解析为位图，或解码结果面积为 0）。
 */
public class DecodeException extends KensaException {

    public static final String CODE = "DECODE_ERROR";

    public DecodeException(String message) {
        super(CODE, message);
    }

    public DecodeException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
