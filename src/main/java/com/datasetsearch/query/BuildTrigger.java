package com.datasetsearch.query;

import com.datasetsearch.index.SplitKey;

/**
 * 查询发现索引缺失时用来触发构建的协作者，只负责提交，不等待完成。
 */
@FunctionalInterface
public interface BuildTrigger {

    void requestBuild(SplitKey key);
}
