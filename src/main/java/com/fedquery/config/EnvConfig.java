package com.fedquery.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * .env 支持
 * <p>
 * 所有覆盖项以 FEDQUERY_ 为前缀；.env 中的值优先，其次系统环境变量。
 * 查找顺序：系统属性 fedquery.env.dir 指定的目录、工作目录、上级目录
 */
@Configuration
public class EnvConfig {
    public static final String PREFIX = "FEDQUERY_";
    public static final String ENV_DIR_PROPERTY = "fedquery.env.dir";
    private static final Logger logger = LoggerFactory.getLogger(EnvConfig.class);
    private static volatile Dotenv dotenv;

    @PostConstruct
    public void loadEnv() {
        Path envDir = locateEnvDir();
        try {
            if (envDir != null) {
                logger.info("Loading .env from {}", envDir);
                dotenv = Dotenv.configure().directory(envDir.toString()).ignoreIfMissing().load();
            } else {
                logger.info("No .env found, FEDQUERY_* overrides come from the process environment");
                dotenv = Dotenv.configure().ignoreIfMissing().load();
            }
        } catch (DotenvException e) {
            logger.error("Malformed .env in {}, skipping bad lines", envDir, e);
            dotenv = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();
        }
    }

    private static Path locateEnvDir() {
        List<Path> candidates = new ArrayList<>();
        String configured = System.getProperty(ENV_DIR_PROPERTY);
        if (configured != null && !configured.isEmpty()) {
            candidates.add(Paths.get(configured));
        }
        Path workDir = Paths.get(System.getProperty("user.dir"));
        candidates.add(workDir);
        if (workDir.getParent() != null) {
            candidates.add(workDir.getParent());
        }
        for (Path dir : candidates) {
            if (Files.isRegularFile(dir.resolve(".env"))) {
                return dir.toAbsolutePath();
            }
        }
        return null;
    }

    /**
     * 读取 FEDQUERY_{name}，未设置或为空白时返回 null
     */
    public static String get(String name) {
        String key = PREFIX + name;
        Dotenv current = dotenv;
        String value = current != null ? current.get(key) : System.getenv(key);
        return value != null && !value.trim().isEmpty() ? value.trim() : null;
    }

    public static long getLong(String name, long defaultValue) {
        String value = get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(PREFIX + name + " must be a number, got '" + value + "'", e);
        }
    }

    public static String get(String name, String defaultValue) {
        String value = get(name);
        return value != null ? value : defaultValue;
    }
}
