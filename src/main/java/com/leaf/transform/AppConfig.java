package com.leaf.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.InputStream;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的系统级参数，文件缺失或读取失败时使用默认值。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    // ---- 数据源 ----
    private String sourceDatabasePath = "data/source.db";

    // ---- 产物 ----
    private String outputDir = "data/artifacts";
    private int namingMaxTokens = 3;

    // ---- 时间分箱 ----
    private int timeBinValidationSampleSize = 100;
    private int timeBinPreviewSampleBins = 10;

    public static AppConfig defaults() {
        return new AppConfig();
    }

    public static AppConfig load(String configPath) {
        AppConfig config = new AppConfig();
        try (InputStream in = new FileInputStream(configPath)) {
            Properties props = new Properties();
            props.load(in);
            config.apply(props);
        } catch (Exception e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
        }
        return config;
    }

    /**
     * 从类路径加载，通常为 {@code transform.properties}
     */
    public static AppConfig loadResource(String resource) {
        AppConfig config = new AppConfig();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Config resource '{}' not found, using defaults.", resource);
                return config;
            }
            Properties props = new Properties();
            props.load(in);
            config.apply(props);
        } catch (Exception e) {
            log.warn("Failed to load config resource {}, using defaults. Error: {}", resource, e.getMessage());
        }
        return config;
    }

    private void apply(Properties props) {
        sourceDatabasePath = props.getProperty("source.database.path", sourceDatabasePath);
        outputDir = props.getProperty("output.dir", outputDir);
        namingMaxTokens = Integer.parseInt(
                props.getProperty("naming.max.tokens", String.valueOf(namingMaxTokens)).trim());
        timeBinValidationSampleSize = Integer.parseInt(
                props.getProperty("timebin.validation.sample.size",
                        String.valueOf(timeBinValidationSampleSize)).trim());
        timeBinPreviewSampleBins = Integer.parseInt(
                props.getProperty("timebin.preview.sample.bins", String.valueOf(timeBinPreviewSampleBins)).trim());
    }

    // ---- Getters ----
    public String getSourceDatabasePath() { return sourceDatabasePath; }
    public String getOutputDir() { return outputDir; }
    public int getNamingMaxTokens() { return namingMaxTokens; }
    public int getTimeBinValidationSampleSize() { return timeBinValidationSampleSize; }
    public int getTimeBinPreviewSampleBins() { return timeBinPreviewSampleBins; }

    @Override
    public String toString() {
        return "AppConfig{source='" + sourceDatabasePath + "'"
                + ", output='" + outputDir + "'"
                + ", maxTokens=" + namingMaxTokens
                + ", sampleSize=" + timeBinValidationSampleSize + "}";
    }
}
