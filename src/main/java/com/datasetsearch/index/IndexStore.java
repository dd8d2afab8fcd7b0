package com.datasetsearch.index;

import com.datasetsearch.schema.Features;

import java.io.IOException;
import java.util.Optional;

/**
 * 索引制品存储：分配新版本、原子发布、按 split 查找当前版本。
 */
public interface IndexStore {

    /**
     * 为 split 分配一个新的暂存版本目录。
     */
    StagedIndex beginVersion(SplitKey key) throws IOException;

    /**
     * 写出索引文件并原子切换当前版本。发布成功前旧版本保持可读。
     */
    PublishedIndex publish(StagedIndex staged, InvertedIndex index, Features features) throws IOException;

    /**
     * 查找 split 当前已发布的版本。
     *
     * @return 尚未构建时为空
     */
    Optional<PublishedIndex> find(SplitKey key);
}
