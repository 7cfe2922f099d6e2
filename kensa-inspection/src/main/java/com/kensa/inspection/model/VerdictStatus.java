package com.kensa.inspection.model;

/**
 * 最终判定。
 */
public enum VerdictStatus {
    PASS,
    FAIL,
    UNCERTAIN,
    INVALID_INPUT
}
