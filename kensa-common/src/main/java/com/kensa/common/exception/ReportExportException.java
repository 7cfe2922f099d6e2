package com.kensa.common.exception;

/**
 * 报告导出异常（PDF 生成失败）。
 */
public class ReportExportException extends KensaException {

    public static final String CODE = "REPORT_EXPORT_ERROR";

    public ReportExportException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
