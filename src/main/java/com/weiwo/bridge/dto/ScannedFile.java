package com.weiwo.bridge.dto;

import java.nio.file.Path;

/**
 * 扫描得到的单个文件
 *
 * @param path  绝对路径
 * @param size  字节数
 * @param mtime 修改时间，epoch 秒（微秒精度）
 */
public record ScannedFile(Path path, long size, double mtime) {

    public String filepath() {
        return path.toString();
    }

    public String filename() {
        return path.getFileName().toString();
    }
}
