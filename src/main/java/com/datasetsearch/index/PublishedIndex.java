package com.datasetsearch.index;

import com.datasetsearch.schema.Features;

import java.nio.file.Path;

/**
 * 已发布的索引版本。查询持有该引用期间，即使新版本发布也始终读到同一份数据。
 *
 * @param key split 标识
 * @param version 版本号
 * @param directory 版本目录，包含索引文件与行存储
 * @param index 内存中的倒排索引
 * @param features 构建时的 schema
 * @param meta 构建元数据
 */
public record PublishedIndex(SplitKey key, int version, Path directory, InvertedIndex index,
                             Features features, IndexMeta meta) {

    public Path rowStorePath() {
        return directory.resolve(IndexFiles.ROWS_DB);
    }
}
