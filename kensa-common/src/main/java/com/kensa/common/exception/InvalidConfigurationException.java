package com.kensa.common.exception;

/**
 * 配置项非法（核大小为偶数、阈值区间颠倒等）。
 */
public class InvalidConfigurationException extends KensaException {

    public InvalidConfigurationException(String message) {
        super("CONFIG_ERROR", message);
    }
}
