package com.weiwo.bridge.service;

import com.weiwo.bridge.config.ApplicationProperties;
import com.weiwo.bridge.dto.ScanResult;
import com.weiwo.bridge.dto.ScannedFile;
import com.weiwo.bridge.exception.FileScanException;
import com.weiwo.bridge.utils.DateUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 文件系统扫描
 * 阻塞 IO，调用方负责切换到 boundedElastic 线程
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemScanner {

    private final ApplicationProperties applicationProperties;

    /**
     * 扫描配置的全部根目录
     *
     * @throws FileScanException 任一根目录不存在或不可读
     */
    public ScanResult scan() {
        return scan(applicationProperties.getSync().getRoots());
    }

    public ScanResult scan(Collection<String> roots) {
        ApplicationProperties.Sync syncConfig = applicationProperties.getSync();
        Set<String> extensions = syncConfig.getSupportedExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        long minFileSize = syncConfig.getMinFileSize();

        NavigableMap<String, ScannedFile> files = new TreeMap<>();
        Set<String> unreadable = new HashSet<>();

        for (String rootValue : roots) {
            Path root = Path.of(rootValue).toAbsolutePath().normalize();
            if (!Files.isDirectory(root)) {
                throw new FileScanException(rootValue, "目录不存在");
            }
            if (!Files.isReadable(root)) {
                throw new FileScanException(rootValue, "目录不可读");
            }
            int before = files.size();
            try {
                Files.walkFileTree(root, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (!attrs.isRegularFile()) {
                            return FileVisitResult.CONTINUE;
                        }
                        if (!extensions.contains(extensionOf(file))) {
                            return FileVisitResult.CONTINUE;
                        }
                        if (attrs.size() < minFileSize) {
                            return FileVisitResult.CONTINUE;
                        }
                        Path absolute = file.toAbsolutePath().normalize();
                        files.put(absolute.toString(), new ScannedFile(absolute, attrs.size(),
                                DateUtils.toEpochSeconds(attrs.lastModifiedTime())));
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                        Path absolute = file.toAbsolutePath().normalize();
                        if (absolute.equals(root)) {
                            throw exc;
                        }
                        log.warn("无法读取文件属性，本次跳过: path={}, error={}", absolute, exc.getMessage());
                        unreadable.add(absolute.toString());
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                        if (exc == null) {
                            return FileVisitResult.CONTINUE;
                        }
                        Path absolute = dir.toAbsolutePath().normalize();
                        if (absolute.equals(root)) {
                            throw exc;
                        }
                        // 目录遍历中途失败，其下已登记的文件不能据此判定为删除
                        log.warn("目录遍历中断，本次跳过: path={}, error={}", absolute, exc.getMessage());
                        unreadable.add(absolute.toString());
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (IOException e) {
                throw new FileScanException(rootValue, e.getMessage(), e);
            }
            log.info("扫描目录完成: root={}, 文件数={}", root, files.size() - before);
        }
        return new ScanResult(files, unreadable);
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
