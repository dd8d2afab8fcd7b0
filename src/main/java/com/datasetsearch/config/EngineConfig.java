package com.datasetsearch.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 引擎运行时配置
 *
 * 支持从CLI参数或 properties 配置文件注入，覆盖Constants默认值
 */
public class EngineConfig {
    private Path datasetsDir = Paths.get("./datasets");
    private Path indexDir = Paths.get("./index");
    private long byteBudget = Constants.DEFAULT_BYTE_BUDGET;
    private int indexThreads = Constants.DEFAULT_INDEX_THREADS;
    private int retainedVersions = Constants.DEFAULT_RETAINED_VERSIONS;
    private double bm25K1 = Constants.BM25_K1;
    private double bm25B = Constants.BM25_B;
    private boolean stopWordsEnabled = false;

    public Path getDatasetsDir() {
        return datasetsDir;
    }

    public void setDatasetsDir(Path datasetsDir) {
        this.datasetsDir = datasetsDir;
    }

    public Path getIndexDir() {
        return indexDir;
    }

    public void setIndexDir(Path indexDir) {
        this.indexDir = indexDir;
    }

    public long getByteBudget() {
        return byteBudget;
    }

    public void setByteBudget(long byteBudget) {
        if (byteBudget < 0) {
            throw new IllegalArgumentException("byteBudget 不能为负数: " + byteBudget);
        }
        this.byteBudget = byteBudget;
    }

    public int getIndexThreads() {
        return indexThreads;
    }

    public void setIndexThreads(int indexThreads) {
        this.indexThreads = indexThreads;
    }

    public int getRetainedVersions() {
        return retainedVersions;
    }

    public void setRetainedVersions(int retainedVersions) {
        if (retainedVersions < 1) {
            throw new IllegalArgumentException("retainedVersions 至少为1: " + retainedVersions);
        }
        this.retainedVersions = retainedVersions;
    }

    public double getBm25K1() {
        return bm25K1;
    }

    public void setBm25K1(double bm25K1) {
        this.bm25K1 = bm25K1;
    }

    public double getBm25B() {
        return bm25B;
    }

    public void setBm25B(double bm25B) {
        this.bm25B = bm25B;
    }

    public boolean isStopWordsEnabled() {
        return stopWordsEnabled;
    }

    public void setStopWordsEnabled(boolean stopWordsEnabled) {
        this.stopWordsEnabled = stopWordsEnabled;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从 properties 文件加载配置，未出现的键保持默认值
     *
     * @param propertiesFile 配置文件路径
     * @return 加载后的配置
     * @throws IOException 读取失败时抛出
     */
    public static EngineConfig load(Path propertiesFile) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    /**
     * 从 Properties 构造配置
     */
    public static EngineConfig fromProperties(Properties properties) {
        EngineConfig config = defaults();
        String value = properties.getProperty("datasets.dir");
        if (value != null) {
            config.setDatasetsDir(Paths.get(value.trim()));
        }
        value = properties.getProperty("index.dir");
        if (value != null) {
            config.setIndexDir(Paths.get(value.trim()));
        }
        value = properties.getProperty("index.byte-budget");
        if (value != null) {
            config.setByteBudget(parseLong("index.byte-budget", value));
        }
        value = properties.getProperty("index.threads");
        if (value != null) {
            config.setIndexThreads((int) parseLong("index.threads", value));
        }
        value = properties.getProperty("index.retained-versions");
        if (value != null) {
            config.setRetainedVersions((int) parseLong("index.retained-versions", value));
        }
        value = properties.getProperty("bm25.k1");
        if (value != null) {
            config.setBm25K1(parseDouble("bm25.k1", value));
        }
        value = properties.getProperty("bm25.b");
        if (value != null) {
            config.setBm25B(parseDouble("bm25.b", value));
        }
        value = properties.getProperty("text.stop-words");
        if (value != null) {
            config.setStopWordsEnabled(Boolean.parseBoolean(value.trim()));
        }
        return config;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim().replace("_", ""));
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException("配置项 " + key + " 不是合法整数: " + value, exception);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException("配置项 " + key + " 不是合法数字: " + value, exception);
        }
    }
}
