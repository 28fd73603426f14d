package com.weiwo.bridge.utils;

import com.weiwo.bridge.config.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 配置验证工具类
 * 启动时检查配置有效性与外部依赖连通性，只记录问题不阻止启动
 */
@Slf4j
@Component
public class ConfigValidator {

    /**
     * 验证应用配置
     */
    public List<String> validateConfiguration(ApplicationProperties properties) {
        List<String> errors = new ArrayList<>();
        errors.addAll(validateDatabaseConfig(properties.getDatabase()));
        errors.addAll(validateApiConfig(properties.getApi()));
        errors.addAll(validateSyncConfig(properties.getSync()));
        errors.addAll(validateContractConfig(properties.getContract()));
        return errors;
    }

    /**
     * 验证数据库配置
     */
    private List<String> validateDatabaseConfig(ApplicationProperties.Database dbConfig) {
        List<String> errors = new ArrayList<>();
        if (dbConfig.getUrl() == null || !dbConfig.getUrl().startsWith("r2dbc:")) {
            errors.add("数据库连接串无效，必须以 r2dbc: 开头: " + dbConfig.getUrl());
        }
        if (dbConfig.getMaxPoolSize() <= 0) {
            errors.add("数据库连接池大小无效: " + dbConfig.getMaxPoolSize());
        }
        return errors;
    }

    /**
     * 验证知识库接口配置
     */
    private List<String> validateApiConfig(ApplicationProperties.Api apiConfig) {
        List<String> errors = new ArrayList<>();

        String baseUrl = apiConfig.getBaseUrl();
        if (baseUrl == null || baseUrl.trim().isEmpty()) {
            errors.add("知识库API基础URL不能为空");
        } else if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            errors.add("知识库API基础URL格式无效，必须以http://或https://开头");
        } else {
            URI uri = parseUri(baseUrl);
            if (uri == null || uri.getHost() == null) {
                errors.add("知识库API基础URL无法解析: " + baseUrl);
            } else {
                int port = uri.getPort() > 0 ? uri.getPort() : ("https".equals(uri.getScheme()) ? 443 : 80);
                if (!testConnection(uri.getHost(), port)) {
                    errors.add(String.format("无法连接到知识库API %s:%d", uri.getHost(), port));
                }
            }
        }

        if (apiConfig.getKnowledgeBaseId() == null || apiConfig.getKnowledgeBaseId().trim().isEmpty()) {
            errors.add("知识库ID未配置（app.api.knowledge-base-id），提交任务将无法执行");
        }
        if (apiConfig.getApiKey() == null || apiConfig.getApiKey().trim().isEmpty()) {
            errors.add("知识库API Key未配置（app.api.api-key）");
        }
        return errors;
    }

    /**
     * 验证同步任务配置
     */
    private List<String> validateSyncConfig(ApplicationProperties.Sync syncConfig) {
        List<String> errors = new ArrayList<>();

        if (syncConfig.getRoots() == null || syncConfig.getRoots().isEmpty()) {
            errors.add("未配置扫描根目录（app.sync.roots）");
        } else {
            for (String root : syncConfig.getRoots()) {
                Path path = Path.of(root);
                if (!Files.isDirectory(path)) {
                    errors.add("扫描根目录不存在: " + root);
                } else if (!Files.isReadable(path)) {
                    errors.add("扫描根目录不可读: " + root);
                }
            }
        }

        if (!FileHashUtils.isSupported(syncConfig.getHashAlgorithm())) {
            errors.add("不支持的摘要算法: " + syncConfig.getHashAlgorithm());
        }
        if (syncConfig.getSubmitBatchSize() <= 0 || syncConfig.getPollBatchSize() <= 0) {
            errors.add("批次大小必须大于0");
        }
        if (syncConfig.getPollMaxPerRun() < 0) {
            errors.add("单次轮询上限不能为负数（0 表示不限）: " + syncConfig.getPollMaxPerRun());
        }
        if (syncConfig.getSubmitConcurrency() <= 0) {
            errors.add("提交并发数必须大于0: " + syncConfig.getSubmitConcurrency());
        }
        return errors;
    }

    /**
     * 验证合同关联配置
     */
    private List<String> validateContractConfig(ApplicationProperties.Contract contractConfig) {
        List<String> errors = new ArrayList<>();
        if (contractConfig.isEnabled() && !Files.isDirectory(Path.of(contractConfig.getDumpDir()))) {
            errors.add("合同导出目录不存在: " + contractConfig.getDumpDir());
        }
        return errors;
    }

    private static URI parseUri(String value) {
        try {
            return URI.create(value.trim());
        } catch (IllegalArgumentException e) {
            log.warn("URL解析失败: {} - {}", value, e.getMessage());
            return null;
        }
    }

    /**
     * 测试网络连接
     */
    private boolean testConnection(String host, int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), 5000); // 5秒超时
            return true;
        } catch (Exception e) {
            log.warn("连接测试失败: {}:{} - {}", host, port, e.getMessage());
            return false;
        }
    }

    /**
     * 打印配置验证结果
     */
    public void printValidationResults(List<String> errors) {
        if (errors.isEmpty()) {
            log.info("✅ 所有配置验证通过");
        } else {
            log.error("❌ 发现 {} 个配置错误:", errors.size());
            for (int i = 0; i < errors.size(); i++) {
                log.error("  {}. {}", i + 1, errors.get(i));
            }
        }
    }
}
