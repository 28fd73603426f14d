package com.weiwo.bridge;

import com.weiwo.bridge.config.ApplicationProperties;
import com.weiwo.bridge.utils.ConfigValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * ERP 文件到知识库同步服务
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties
public class KnowledgeBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowledgeBridgeApplication.class, args);
    }

    /**
     * 应用启动后执行配置验证
     */
    @Bean
    @ConditionalOnProperty(prefix = "app", name = "validate-on-startup", havingValue = "true", matchIfMissing = true)
    public CommandLineRunner configValidationRunner(ApplicationProperties properties, ConfigValidator validator) {
        return args -> {
            log.info("🚀 ERP知识库同步服务启动完成，开始验证配置...");

            var errors = validator.validateConfiguration(properties);
            validator.printValidationResults(errors);

            if (!errors.isEmpty()) {
                log.warn("⚠️  发现配置问题，但服务将继续运行。建议检查并修复上述问题。");
            } else {
                log.info("✅ 配置验证通过，服务已就绪！");
            }
        };
    }
}
