package com.kensa.image.service;

import com.kensa.common.exception.DecodeException;
import com.kensa.image.model.PixelGrid;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;

import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * 图片解码服务：字节流 -> 像素网格。
 * <p>
 * 同样的字节永远得到同样的网格，无副作用。
 */
@Slf4j
@Service
public class ImageDecoder {

    public PixelGrid decode(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new DecodeException("图片内容为空");
        }

        Mat raw;
        try {
            raw = opencv_imgcodecs.imdecode(new Mat(imageBytes), opencv_imgcodecs.IMREAD_ANYCOLOR);
        } catch (Exception e) {
            throw new DecodeException("读取图片失败", e);
        }
        if (raw == null || raw.empty() || raw.cols() == 0 || raw.rows() == 0) {
            throw new DecodeException("无法解码图片，请确认图片格式正确");
        }

        Mat normalized = raw;
        if (raw.channels() == 4) {
            normalized = new Mat();
            cvtColor(raw, normalized, COLOR_BGRA2BGR);
        } else if (raw.channels() != 1 && raw.channels() != 3) {
            throw new DecodeException("不支持的通道数: " + raw.channels());
        }

        PixelGrid grid = MatConverter.toGrid(normalized);
        log.info("图片解码成功: {}x{}, {} 通道", grid.getWidth(), grid.getHeight(), grid.getChannels());
        return grid;
    }
}
