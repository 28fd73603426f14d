package com.weiwo.bridge.exception;

/**
 * 扫描根目录失败（目录不存在、无权限），整次发现任务中止
 */
public class FileScanException extends ApiException {

    private final String root;

    public FileScanException(String root, String message) {
        super(String.format("扫描目录失败 %s: %s", root, message), 500);
        this.root = root;
    }

    public FileScanException(String root, String message, Throwable cause) {
        super(String.format("扫描目录失败 %s: %s", root, message), 500, cause);
        this.root = root;
    }

    public String getRoot() {
        return root;
    }
}
