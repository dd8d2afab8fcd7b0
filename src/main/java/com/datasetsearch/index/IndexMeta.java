package com.datasetsearch.index;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * 索引版本元数据，描述一次构建的统计信息。
 */
public record IndexMeta(
    String dataset,
    String config,
    String split,
    int version,
    int rowsIndexed,
    int rowsSkipped,
    long consumedBytes,
    long byteBudget,
    boolean partial,
    long totalRowLength,
    double averageRowLength,
    Map<String, Long> columnLengths,
    int termCount,
    long rowLengthsOffset,
    Instant createTime
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * 根据构建结果生成元数据。
     */
    public static IndexMeta of(SplitKey key, int version, InvertedIndex index, long rowLengthsOffset, Instant createTime) {
        return new IndexMeta(
            key.dataset(),
            key.config(),
            key.split(),
            version,
            index.rowsIndexed(),
            index.rowsSkipped(),
            index.consumedBytes(),
            index.byteBudget(),
            index.isPartial(),
            index.rowLengths().totalLength(),
            index.averageRowLength(),
            index.columnLengths(),
            index.termCount(),
            rowLengthsOffset,
            createTime
        );
    }

    @JsonIgnore
    public SplitKey splitKey() {
        return new SplitKey(dataset, config, split);
    }

    /**
     * 将元数据写入指定 JSON 文件。
     *
     * @param file 元数据文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, this);
        } catch (IOException exception) {
            throw new IOException("写入索引元数据失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 从指定 JSON 文件读取元数据。
     *
     * @param file 元数据文件
     * @return 反序列化后的元数据
     * @throws IOException 读取或解析失败时抛出
     */
    public static IndexMeta readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file, IndexMeta.class);
        } catch (IOException exception) {
            throw new IOException("读取索引元数据失败: " + file.getAbsolutePath(), exception);
        }
    }
}
