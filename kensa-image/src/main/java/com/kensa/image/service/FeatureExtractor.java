package com.kensa.image.service;

import com.kensa.common.exception.FeatureExtractionException;
import com.kensa.image.config.OpenCvProperties;
import com.kensa.image.model.BinaryMask;
import com.kensa.image.model.FeatureExtraction;
import com.kensa.image.model.FeatureMap;
import com.kensa.image.model.PixelGrid;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_imgproc.CLAHE;
import org.springframework.stereotype.Service;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * 特征提取服务：灰度化 -> 去噪 -> (CLAHE) -> 梯度幅值 -> Otsu 二值化 -> 闭运算。
 * <p>
 * 幅值图按单张图自身的最大梯度重标定到 255，因此缺陷分数是相对值，不受不同相机曝光差异影响。
 * 去噪必须在求梯度之前做，否则模糊会抹掉真实边缘。
 */
@Slf4j
@Service
public class FeatureExtractor {

    /** 最大梯度低于此值视为无纹理（纯色图） */
    private static final double MIN_GRADIENT = 1e-6;

    public FeatureExtraction extract(PixelGrid grid, OpenCvProperties config) {
        try {
            Mat gray = toGrayscale(MatConverter.toMat(grid));
            Mat denoised = denoise(gray, config.getGaussianKernelSize());
            Mat enhanced = config.isClaheEnabled()
                    ? equalize(denoised, config.getClaheClipLimit(), config.getClaheTileSize())
                    : denoised;

            Mat magnitude = gradientMagnitude(enhanced, config.getSobelKernelSize());
            float[] raw = MatConverter.toFloats(magnitude);
            double max = 0;
            for (float v : raw) {
                if (v > max) max = v;
            }
            if (!(max > MIN_GRADIENT)) {
                throw new FeatureExtractionException("图像梯度全为 0（疑似纯色图），无法提取缺陷特征");
            }

            double scale = 255.0 / max;
            float[] rescaled = new float[raw.length];
            for (int i = 0; i < raw.length; i++) {
                rescaled[i] = (float) (raw[i] * scale);
            }
            FeatureMap featureMap = new FeatureMap(grid.getWidth(), grid.getHeight(), rescaled);

            Mat magnitude8u = new Mat();
            magnitude.convertTo(magnitude8u, CV_8U, scale, 0);
            Mat binary = new Mat();
            double otsu = threshold(magnitude8u, binary, 0, 255, THRESH_BINARY | THRESH_OTSU);

            Mat closed = close(binary, config.getClosingKernelSize());
            BinaryMask mask = toMask(closed, grid.getWidth(), grid.getHeight());

            log.debug("特征提取完成: 最大梯度={}, Otsu 阈值={}, 边缘像素={}",
                    String.format("%.2f", max), otsu, mask.foregroundCount());
            return new FeatureExtraction(featureMap, mask, otsu);

        } catch (FeatureExtractionException e) {
            throw e;
        } catch (Exception e) {
            throw new FeatureExtractionException("特征提取失败", e);
        }
    }

    /**
     * 灰度化（BT.601 权重：0.299R + 0.587G + 0.114B）。
     */
    Mat toGrayscale(Mat src) {
        if (src.channels() == 1) {
            return src;
        }
        Mat gray = new Mat();
        cvtColor(src, gray, COLOR_BGR2GRAY);
        return gray;
    }

    Mat denoise(Mat gray, int kernelSize) {
        Mat blurred = new Mat();
        GaussianBlur(gray, blurred, new Size(kernelSize, kernelSize), 0);
        return blurred;
    }

    /**
     * 分块直方图均衡（CLAHE），补偿产线光照不均。
     */
    Mat equalize(Mat gray, double clipLimit, int tileSize) {
        Mat equalized = new Mat();
        CLAHE clahe = createCLAHE(clipLimit, new Size(tileSize, tileSize));
        clahe.apply(gray, equalized);
        return equalized;
    }

    /**
     * 水平/垂直一阶导数的欧氏范数，输出 CV_32F。
     */
    Mat gradientMagnitude(Mat gray, int kernelSize) {
        Mat gx = new Mat();
        Mat gy = new Mat();
        Sobel(gray, gx, CV_32F, 1, 0, kernelSize, 1, 0, BORDER_DEFAULT);
        Sobel(gray, gy, CV_32F, 0, 1, kernelSize, 1, 0, BORDER_DEFAULT);
        Mat magnitude = new Mat();
        magnitude(gx, gy, magnitude);
        return magnitude;
    }

    /**
     * 闭运算：把相距很近的边缘碎片连成一个区域。
     */
    Mat close(Mat binary, int kernelSize) {
        Mat kernel = getStructuringElement(MORPH_RECT, new Size(kernelSize, kernelSize));
        Mat closed = new Mat();
        morphologyEx(binary, closed, MORPH_CLOSE, kernel);
        return closed;
    }

    private BinaryMask toMask(Mat binary, int width, int height) {
        byte[] pixels = MatConverter.toBytes(binary);
        byte[] bits = new byte[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            bits[i] = pixels[i] != 0 ? (byte) 1 : (byte) 0;
        }
        return new BinaryMask(width, height, bits);
    }
}
