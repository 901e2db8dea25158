package com.fedquery.meta;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class Parser {
    private final String filePath;
    private final ObjectMapper yamlMapper;

    public Parser(String filePath) {
        this.filePath = filePath;
        // 使用字段上的 @JsonProperty（下划线命名）反序列化
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public boolean exists() {
        return new File(filePath).exists();
    }

    public FederationCatalog parse() throws IOException {
        File file = new File(filePath);
        if (!file.exists()) {
            throw new IOException("Catalog file not found: " + filePath);
        }
        return yamlMapper.readValue(file, FederationCatalog.class);
    }

    public FederationCatalog parse(InputStream input) throws IOException {
        return yamlMapper.readValue(input, FederationCatalog.class);
    }
}
