package com.datasetsearch.storage;

import com.datasetsearch.config.Constants;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;

/**
 * 倒排文件写入器。每个块依次是行数、行号增量区和取值区（词频或行长度），读取时整块解码。
 */
public final class PostingsWriter implements AutoCloseable {
    private final RandomAccessFile randomAccessFile;
    private final String postingsFileName;
    private boolean closed;

    /**
     * 创建倒排写入器并写入文件头。
     *
     * @param file 倒排文件
     * @throws IOException 初始化失败时抛出
     */
    public PostingsWriter(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("倒排文件不能为空");
        }
        this.randomAccessFile = new RandomAccessFile(file, "rw");
        this.postingsFileName = file.getName();
        this.randomAccessFile.setLength(0L);
        this.randomAccessFile.writeInt(Constants.POSTINGS_MAGIC);
        this.randomAccessFile.writeShort(Constants.FORMAT_VERSION);
    }

    /**
     * 写入一条倒排列表并返回写入起始偏移。
     *
     * @param postingList 倒排列表
     * @return 该倒排列表在文件中的偏移
     * @throws IOException 写入失败时抛出
     */
    public long writePostingList(PostingList postingList) throws IOException {
        return writeBlock(postingList.rowIndices(), postingList.termFreqs());
    }

    /**
     * 写入行长度表并返回写入起始偏移，格式与倒排列表相同。
     */
    public long writeRowLengths(RowLengths rowLengths) throws IOException {
        return writeBlock(rowLengths.rowIndices(), rowLengths.lengths());
    }

    private long writeBlock(int[] rowIndices, int[] values) throws IOException {
        ensureOpen();
        validateInput(rowIndices, values);

        long blockOffset = randomAccessFile.getFilePointer();
        StorageFileUtil.writeVarInt(randomAccessFile, rowIndices.length);
        for (int delta : DeltaCodec.encode(rowIndices)) {
            StorageFileUtil.writeVarInt(randomAccessFile, delta);
        }
        for (int value : values) {
            StorageFileUtil.writeVarInt(randomAccessFile, value);
        }
        return blockOffset;
    }

    /**
     * 关闭写入器并追加文件级 CRC32。
     *
     * @throws IOException 关闭失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            randomAccessFile.seek(randomAccessFile.length());
            StorageFileUtil.appendCrc32Footer(randomAccessFile);
        } catch (IOException exception) {
            throw new IOException("关闭倒排写入器失败: file=" + postingsFileName, exception);
        } finally {
            randomAccessFile.close();
            closed = true;
        }
    }

    private void validateInput(int[] rowIndices, int[] values) {
        if (rowIndices.length != values.length) {
            throw new IllegalArgumentException("rowIndices 与取值长度不一致: " + rowIndices.length + " vs " + values.length);
        }
        for (int index = 0; index < rowIndices.length; index++) {
            if (values[index] < 0) {
                throw new IllegalArgumentException("取值不能为负数: " + values[index]);
            }
            if (index > 0 && rowIndices[index] <= rowIndices[index - 1]) {
                throw new IllegalArgumentException("rowIndices 必须严格递增");
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("PostingsWriter 已关闭");
        }
    }
}
