package com.kensa.image.service;

import com.kensa.image.model.BinaryMask;
import com.kensa.image.model.PixelGrid;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * PixelGrid 与 OpenCV Mat 之间的拷贝转换。
 */
final class MatConverter {

    private MatConverter() {
    }

    static Mat toMat(PixelGrid grid) {
        int type = grid.getChannels() == 3 ? CV_8UC3 : CV_8UC1;
        Mat mat = new Mat(grid.getHeight(), grid.getWidth(), type);
        mat.data().put(grid.getSamples());
        return mat;
    }

    /**
     * 前景写为 255，背景为 0 的 CV_8UC1。
     */
    static Mat toMat(BinaryMask mask) {
        int w = mask.getWidth();
        int h = mask.getHeight();
        byte[] samples = new byte[w * h];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = mask.isForeground(i) ? (byte) 255 : 0;
        }
        Mat mat = new Mat(h, w, CV_8UC1);
        mat.data().put(samples);
        return mat;
    }

    /**
     * 仅接受 8 位 1/3 通道的 Mat。
     */
    static PixelGrid toGrid(Mat mat) {
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        int channels = continuous.channels();
        byte[] samples = new byte[continuous.rows() * continuous.cols() * channels];
        continuous.data().get(samples);
        return new PixelGrid(continuous.cols(), continuous.rows(), channels, samples);
    }

    static byte[] toBytes(Mat mat8u) {
        Mat continuous = mat8u.isContinuous() ? mat8u : mat8u.clone();
        byte[] out = new byte[continuous.rows() * continuous.cols() * continuous.channels()];
        BytePointer data = continuous.data();
        data.get(out);
        return out;
    }

    /**
     * 读取 CV_32F Mat 的全部元素。
     */
    static float[] toFloats(Mat mat32f) {
        Mat continuous = mat32f.isContinuous() ? mat32f : mat32f.clone();
        float[] out = new float[continuous.rows() * continuous.cols() * continuous.channels()];
        FloatPointer ptr = new FloatPointer(continuous.data());
        ptr.get(out);
        return out;
    }

    /**
     * 读取 CV_32S Mat 的全部元素。
     */
    static int[] toInts(Mat mat32s) {
        Mat continuous = mat32s.isContinuous() ? mat32s : mat32s.clone();
        int[] out = new int[continuous.rows() * continuous.cols() * continuous.channels()];
        IntPointer ptr = new IntPointer(continuous.data());
        ptr.get(out);
        return out;
    }
}
