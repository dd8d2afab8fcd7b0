package com.datasetsearch.dataset;

import com.datasetsearch.error.UnsupportedDatasetException;
import com.datasetsearch.index.SplitKey;
import com.datasetsearch.schema.Features;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 一个 split 的列式导出：schema 文件与行文件。
 */
public record SplitExport(SplitKey key, Path directory, Path featuresFile, Path rowsFile) {

    /**
     * 读取并解析 schema。
     *
     * @throws UnsupportedDatasetException schema 无法读取或含无法识别的类型时抛出
     */
    public Features readFeatures() {
        try {
            return Features.read(featuresFile);
        } catch (IOException exception) {
            throw new UnsupportedDatasetException("无法读取 split 的 schema: " + key, exception);
        }
    }

    public RowSource openRows() throws IOException {
        return new JsonLinesRowSource(rowsFile);
    }
}
