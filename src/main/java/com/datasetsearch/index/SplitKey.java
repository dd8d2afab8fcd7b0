package com.datasetsearch.index;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 索引的唯一标识：数据集、配置与 split 三元组。
 */
public record SplitKey(String dataset, String config, String split) {

    public SplitKey {
        requireNonBlank("dataset", dataset);
        requireNonBlank("config", config);
        requireNonBlank("split", split);
    }

    /**
     * 在索引根目录下的相对路径，每段做 URL 编码，避免数据集名中的 "/" 或 ".." 越出根目录。
     */
    public Path relativePath() {
        return Paths.get(encode(dataset), encode(config), encode(split));
    }

    @Override
    public String toString() {
        return dataset + "/" + config + "/" + split;
    }

    private static String encode(String segment) {
        String encoded = URLEncoder.encode(segment, StandardCharsets.UTF_8);
        // URLEncoder 不编码 "."，单独的 "." 与 ".." 仍有路径含义
        if (encoded.equals(".") || encoded.equals("..")) {
            return encoded.replace(".", "%2E");
        }
        return encoded;
    }

    private static void requireNonBlank(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " 不能为空");
        }
    }
}
