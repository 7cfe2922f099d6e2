package com.kensa.common.exception;

/**
 * 特征提取异常（纯色图无梯度、OpenCV 处理失败等）。
 */
public class FeatureExtractionException extends KensaException {

    public static final String CODE = "FEATURE_EXTRACTION_ERROR";

    public FeatureExtractionException(String message) {
        super(CODE, message);
    }

    public FeatureExtractionException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
