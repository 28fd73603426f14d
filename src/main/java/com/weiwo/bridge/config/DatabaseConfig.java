package com.weiwo.bridge.config;

import com.weiwo.bridge.entity.FileStatus;
import io.r2dbc.pool.ConnectionPool;
import io.r2dbc.pool.ConnectionPoolConfiguration;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.r2dbc.config.AbstractR2dbcConfiguration;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.lang.NonNull;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static io.r2dbc.spi.ConnectionFactoryOptions.PASSWORD;
import static io.r2dbc.spi.ConnectionFactoryOptions.USER;

/**
 * 响应式数据库配置类
 * 台账库生产环境使用 MySQL（InnoDB 的 redo log 与 MVCC 保证写入提交时读不被阻塞），测试使用 H2
 */
@Slf4j
@Configuration
@EnableR2dbcRepositories(basePackages = "com.weiwo.bridge.repository")
public class DatabaseConfig extends AbstractR2dbcConfiguration {

    @Autowired
    private ApplicationProperties applicationProperties;

    /**
     * 配置R2DBC连接工厂
     */
    @Override
    @Bean
    @NonNull
    public ConnectionFactory connectionFactory() {
        ApplicationProperties.Database dbConfig = applicationProperties.getDatabase();

        ConnectionFactoryOptions.Builder builder = ConnectionFactoryOptions.parse(dbConfig.getUrl()).mutate();
        if (dbConfig.getUsername() != null && !dbConfig.getUsername().isBlank()) {
            builder.option(USER, dbConfig.getUsername());
        }
        if (dbConfig.getPassword() != null && !dbConfig.getPassword().isEmpty()) {
            builder.option(PASSWORD, dbConfig.getPassword());
        }

        ConnectionFactory connectionFactory = ConnectionFactories.get(builder.build());

        ConnectionPoolConfiguration poolConfig = ConnectionPoolConfiguration.builder(connectionFactory)
                .maxIdleTime(Duration.ofMinutes(5))
                .maxLifeTime(Duration.ofMinutes(20))
                .maxAcquireTime(dbConfig.getMaxAcquireTime())
                .maxCreateConnectionTime(Duration.ofSeconds(20))
                .initialSize(dbConfig.getInitialPoolSize())
                .maxSize(dbConfig.getMaxPoolSize())
                .validationQuery("SELECT 1")
                .build();

        log.info("初始化台账数据库连接池: maxSize={}", dbConfig.getMaxPoolSize());
        return new ConnectionPool(poolConfig);
    }

    /**
     * 启动时建表
     */
    @Bean
    public ConnectionFactoryInitializer ledgerSchemaInitializer(ConnectionFactory connectionFactory) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource("schema.sql")));
        initializer.setEnabled(applicationProperties.getDatabase().isInitializeSchema());
        return initializer;
    }

    /**
     * 状态字段以小写文本存储
     */
    @Override
    @NonNull
    protected List<Object> getCustomConverters() {
        List<Object> converters = new ArrayList<>();
        converters.add(new FileStatusToStringConverter());
        converters.add(new StringToFileStatusConverter());
        return converters;
    }

    @WritingConverter
    static class FileStatusToStringConverter implements Converter<FileStatus, String> {
        @Override
        public String convert(@NonNull FileStatus source) {
            return source.getValue();
        }
    }

    @ReadingConverter
    static class StringToFileStatusConverter implements Converter<String, FileStatus> {
        @Override
        public FileStatus convert(@NonNull String source) {
            return FileStatus.fromValue(source);
        }
    }
}
