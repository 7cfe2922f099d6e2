package com.kensa.image.service;

import com.kensa.image.model.BinaryMask;
import com.kensa.image.model.Region;
import com.kensa.image.model.RegionSet;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.bytedeco.opencv.global.opencv_core.CV_32S;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * 区域分析服务：从二值掩码中提取 8 连通前景区域，按最小面积过滤。
 * <p>
 * 区域按行扫描时首次遇到的像素排序，结果可复现。没有区域是合法结果，不抛异常。
 */
@Slf4j
@Service
public class RegionAnalyzer {

    private static final int CONNECTIVITY = 8;

    public RegionSet analyze(BinaryMask mask, int minArea) {
        List<Region> discovered = discover(mask);

        List<Region> significant = discovered.stream()
                .filter(r -> r.getArea() >= minArea)
                .collect(Collectors.toList());

        log.debug("连通域 {} 个，面积过滤 (>= {}px) 后保留 {} 个",
                discovered.size(), minArea, significant.size());
        return significant.isEmpty() ? RegionSet.empty() : new RegionSet(significant);
    }

    /**
     * 连通域标记后按标签首次出现的行扫描位置排序，返回全部连通域（未过滤）。
     */
    private List<Region> discover(BinaryMask mask) {
        Mat binary = MatConverter.toMat(mask);
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        int count = connectedComponentsWithStats(binary, labels, stats, centroids, CONNECTIVITY, CV_32S);

        List<Region> regions = new ArrayList<>();
        if (count <= 1) {
            return regions;
        }

        // 标签 0 为背景
        int[] labelOf = MatConverter.toInts(labels);
        int[] stat = MatConverter.toInts(stats);
        int columns = stats.cols();
        boolean[] seen = new boolean[count];

        for (int label : labelOf) {
            if (label == 0 || seen[label]) continue;
            seen[label] = true;
            int row = label * columns;
            regions.add(Region.builder()
                    .area(stat[row + CC_STAT_AREA])
                    .x(stat[row + CC_STAT_LEFT])
                    .y(stat[row + CC_STAT_TOP])
                    .width(stat[row + CC_STAT_WIDTH])
                    .height(stat[row + CC_STAT_HEIGHT])
                    .build());
        }
        return regions;
    }
}
