package com.datasetsearch.dataset;

import com.datasetsearch.row.SourceRow;

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * 按行号升序逐行读取一个 split 的行流。
 */
public interface RowSource extends Closeable {

    /**
     * 读取下一行。
     *
     * @return 下一行，行流结束时为空
     * @throws IOException 底层读取失败时抛出
     */
    Optional<SourceRow> next() throws IOException;

    /**
     * 基于内存列表的行流。
     */
    static RowSource of(List<SourceRow> rows) {
        Iterator<SourceRow> iterator = List.copyOf(rows).iterator();
        return new RowSource() {
            @Override
            public Optional<SourceRow> next() {
                return iterator.hasNext() ? Optional.of(iterator.next()) : Optional.empty();
            }

            @Override
            public void close() {
                // 无外部资源
            }
        };
    }
}
