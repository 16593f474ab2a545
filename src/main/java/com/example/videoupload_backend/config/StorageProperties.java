package com.example.videoupload_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    private String baseDir = "./data";
    private String chunkPrefix = "chunks";
    private String externalPrefix = "uploads";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getChunkPrefix() { return chunkPrefix; }
    public void setChunkPrefix(String chunkPrefix) { this.chunkPrefix = chunkPrefix; }

    public String getExternalPrefix() { return externalPrefix; }
    public void setExternalPrefix(String externalPrefix) { this.externalPrefix = externalPrefix; }
}
