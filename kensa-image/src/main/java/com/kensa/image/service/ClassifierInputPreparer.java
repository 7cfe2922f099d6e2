package com.kensa.image.service;

import com.kensa.common.exception.FeatureExtractionException;
import com.kensa.image.model.ClassifierInput;
import com.kensa.image.model.PixelGrid;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.springframework.stereotype.Service;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * 分类模型输入预处理：缩放到固定边长、BGR 转 RGB、归一化到 0-1。
 * <p>
 * 门控模型与缺陷模型共用同一份输入。
 */
@Service
public class ClassifierInputPreparer {

    public ClassifierInput prepare(PixelGrid grid, int inputSize) {
        Mat src = MatConverter.toMat(grid);
        Mat bgr = src;
        if (grid.getChannels() == 1) {
            bgr = new Mat();
            cvtColor(src, bgr, COLOR_GRAY2BGR);
        }

        Mat resized = new Mat();
        resize(bgr, resized, new Size(inputSize, inputSize), 0, 0, INTER_AREA);

        Mat rgb = new Mat();
        cvtColor(resized, rgb, COLOR_BGR2RGB);
        Mat normalized = new Mat();
        rgb.convertTo(normalized, CV_32F, 1.0 / 255.0, 0);

        return new ClassifierInput(inputSize, inputSize, MatConverter.toFloats(normalized), encodePng(resized));
    }

    /**
     * Mat 转 PNG 字节（用于 HTTP 传输）。编码失败属于本地图像处理错误。
     */
    static byte[] encodePng(Mat mat) {
        BytePointer buf = new BytePointer();
        try {
            boolean ok;
            try {
                ok = opencv_imgcodecs.imencode(".png", mat, buf);
            } catch (RuntimeException e) {
                throw new FeatureExtractionException("模型输入编码为 PNG 失败: " + e.getMessage(), e);
            }
            if (!ok || buf.limit() == 0) {
                throw new FeatureExtractionException("模型输入编码为 PNG 失败");
            }
            byte[] result = new byte[(int) buf.limit()];
            buf.get(result);
            return result;
        } finally {
            buf.deallocate();
        }
    }
}
