package com.datasetsearch.dataset;

import com.datasetsearch.error.UnsupportedDatasetException;
import com.datasetsearch.error.ValidationException;
import com.datasetsearch.index.SplitKey;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 定位数据集 split 的列式导出：{@code <root>/<dataset>/<config>/<split>/}。
 *
 * 数据集名可以带命名空间（如 {@code user/name}），对应两级目录。
 */
public class DatasetCatalog {
    static final String FEATURES_FILE = "features.json";
    static final String ROWS_FILE = "rows.jsonl";

    private final Path root;

    public DatasetCatalog(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * 查找 split 的导出。
     *
     * @throws UnsupportedDatasetException 没有导出文件时抛出
     * @throws ValidationException 名称试图越出根目录时抛出
     */
    public SplitExport locate(SplitKey key) {
        Path directory = root.resolve(key.dataset()).resolve(key.config()).resolve(key.split()).normalize();
        if (!directory.startsWith(root) || directory.equals(root)) {
            throw new ValidationException("dataset", "路径越界: " + key);
        }
        Path featuresFile = directory.resolve(FEATURES_FILE);
        Path rowsFile = directory.resolve(ROWS_FILE);
        if (!Files.isRegularFile(featuresFile) || !Files.isRegularFile(rowsFile)) {
            throw new UnsupportedDatasetException("数据集没有可用的列式导出: " + key);
        }
        return new SplitExport(key, directory, featuresFile, rowsFile);
    }

    public Path getRoot() {
        return root;
    }
}
