package com.weiwo.bridge.utils;

import java.nio.file.attribute.FileTime;
import java.util.concurrent.TimeUnit;

public class DateUtils {

    /**
     * 文件修改时间转为 epoch 秒（保留微秒精度）
     */
    public static double toEpochSeconds(FileTime fileTime) {
        long micros = fileTime.to(TimeUnit.MICROSECONDS);
        return micros / 1_000_000.0;
    }

    /**
     * 比较两个修改时间，容忍浮点存储引入的亚微秒误差
     */
    public static boolean sameModifiedTime(Double stored, double observed) {
        return stored != null && Math.abs(stored - observed) < 1e-6;
    }

    /**
     * 持续时间（秒，保留三位小数）
     */
    public static double secondsSince(long startNanos) {
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        return elapsedMillis / 1000.0;
    }
}
