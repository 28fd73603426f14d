package com.weiwo.bridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 应用配置属性类
 * 对应 application.yml 中 app.* 配置
 */
@Data
@Component
@ConfigurationProperties(prefix = "app")
public class ApplicationProperties {

    private Database database = new Database();
    private Api api = new Api();
    private Sync sync = new Sync();
    private Contract contract = new Contract();

    @Data
    public static class Database {
        /** R2DBC 连接串，例如 r2dbc:mysql://host:3306/knowledge_bridge */
        private String url = "r2dbc:mysql://localhost:3306/knowledge_bridge";
        private String username = "bridge";
        private String password = "";
        private int initialPoolSize = 2;
        private int maxPoolSize = 10;
        private Duration maxAcquireTime = Duration.ofSeconds(20);
        /** 启动时执行 schema.sql（CREATE TABLE IF NOT EXISTS） */
        private boolean initializeSchema = true;
    }

    @Data
    public static class Api {
        private String baseUrl = "http://localhost:8000/api/v1";
        private String apiKey = "";
        private String knowledgeBaseId = "";
        private boolean enableMultimodel = false;
        private Duration connectTimeout = Duration.ofSeconds(10);
        /** 单次请求超时，上传大文件时应适当调大 */
        private Duration responseTimeout = Duration.ofSeconds(60);
        private int maxConnections = 50;
        private int maxInMemorySize = 10 * 1024 * 1024;
    }

    @Data
    public static class Sync {
        /** 需要扫描的根目录 */
        private List<String> roots = new ArrayList<>();
        private Set<String> supportedExtensions = new LinkedHashSet<>(List.of(
                "pdf", "doc", "docx", "md", "markdown", "txt",
                "xlsx", "xls", "csv",
                "jpg", "jpeg", "png", "gif"));
        /** 小于该大小（字节）的文件忽略 */
        private long minFileSize = 1024;

        private int submitBatchSize = 50;
        private int submitConcurrency = 1;
        private String hashAlgorithm = "SHA-256";

        private int pollBatchSize = 50;
        /** 单次轮询上限，0 表示不限，每次运行遍历全部活动记录 */
        private int pollMaxPerRun = 0;
        /** 两次状态查询之间的间隔，避免压垮外部接口 */
        private Duration pollRequestInterval = Duration.ofMillis(200);

        private boolean schedulingEnabled = true;
        private long discoverIntervalMs = 600_000L;
        private long submitIntervalMs = 120_000L;
        private long pollIntervalMs = 120_000L;
        private long initialDelayMs = 10_000L;
    }

    @Data
    public static class Contract {
        private boolean enabled = false;
        /** 合同导出目录，每个子目录对应一个 ERP 数据库 */
        private String dumpDir = "";
        private String fileName = "contract.csv";
        private long intervalMs = 3_600_000L;
    }
}
