package com.fedquery;

import com.fedquery.adapter.SourceAdapterFactory;
import com.fedquery.config.Config;
import com.fedquery.config.EnvConfig;
import com.fedquery.mapping.SchemaMappingApplier;
import com.fedquery.mapping.TransformRegistry;
import com.fedquery.meta.Loader;
import com.fedquery.meta.Validator;
import com.fedquery.repository.PathManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.io.IOException;
import java.time.Clock;

@SpringBootApplication
@EnableConfigurationProperties(Config.class)
@Import(EnvConfig.class)
public class FedQueryApplication {
    private static final Logger logger = LoggerFactory.getLogger(FedQueryApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(FedQueryApplication.class, args);
    }

    @Bean
    public Loader catalogLoader(Config config) {
        String filePath = config.getCatalogFilePath();
        Loader loader = new Loader(filePath);
        try {
            loader.load();
        } catch (IOException | Validator.ValidationException e) {
            logger.error("Failed to load catalog from: {}", filePath, e);
            throw new IllegalStateException("Failed to load catalog: " + e.getMessage(), e);
        }
        return loader;
    }

    @Bean
    public PathManager pathManager(Config config, Loader loader) {
        String namespace = loader.getCatalog().getNamespace() != null
            ? loader.getCatalog().getNamespace()
            : "default";
        return new PathManager(config.getDataRootPath(), namespace);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SourceAdapterFactory sourceAdapterFactory() {
        return new SourceAdapterFactory();
    }

    @Bean
    public TransformRegistry transformRegistry() {
        return new TransformRegistry();
    }

    @Bean
    public SchemaMappingApplier schemaMappingApplier(TransformRegistry transformRegistry) {
        return new SchemaMappingApplier(transformRegistry);
    }
}
