package com.weiwo.bridge.dto;

import java.io.File;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.Set;

/**
 * 一次完整扫描的结果
 * unreadable 中的文件，以及不可读目录下的所有路径，既不新增也不视为已删除
 */
public record ScanResult(NavigableMap<String, ScannedFile> files, Set<String> unreadable) {

    public ScanResult {
        files = Collections.unmodifiableNavigableMap(files);
        unreadable = Collections.unmodifiableSet(unreadable);
    }

    public boolean isUnreadable(String filepath) {
        for (String path : unreadable) {
            if (filepath.equals(path) || filepath.startsWith(path + File.separator)) {
                return true;
            }
        }
        return false;
    }
}
