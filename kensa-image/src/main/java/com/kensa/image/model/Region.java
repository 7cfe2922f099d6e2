package com.kensa.image.model;

import lombok.Builder;
import lombok.Value;

/**
 * 一个 8 连通前景区域，视为一处候选缺陷。
 */
@Value
@Builder
public class Region {

    /** 像素面积 */
    double area;

    /** 外接矩形左上角 X */
    int x;

    /** 外接矩形左上角 Y */
    int y;

    int width;

    int height;
}
