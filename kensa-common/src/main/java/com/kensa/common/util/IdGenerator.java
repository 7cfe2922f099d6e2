package com.kensa.common.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * 检测单号生成器。
 */
public final class IdGenerator {

    private static final DateTimeFormatter DAY_FMT = DateTimeFormatter.BASIC_ISO_DATE;

    private IdGenerator() {
    }

    /**
     * 生成检测单号，如 "INSP-20261019-3f9a0c1b2d4e"，同一天的单号按日期前缀聚集。
     */
    public static String inspectionId(LocalDate day) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return "INSP-" + day.format(DAY_FMT) + "-" + random;
    }

    public static String inspectionId() {
        return inspectionId(LocalDate.now());
    }
}
