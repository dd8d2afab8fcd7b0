package com.datasetsearch.storage;

import com.datasetsearch.config.Constants;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;

/**
 * 倒排文件读取器，按偏移读取单条倒排列表或行长度表。
 */
public final class PostingsReader implements AutoCloseable {
    private static final long HEADER_LENGTH = Integer.BYTES + Short.BYTES;

    private final RandomAccessFile randomAccessFile;
    private final String postingsFileName;
    private final long dataLength;
    private boolean closed;

    /**
     * 构造读取器并完成文件头与 CRC 校验。
     *
     * @param file 倒排文件
     * @throws IOException 文件损坏或版本不兼容时抛出
     */
    public PostingsReader(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("倒排文件不能为空");
        }
        this.randomAccessFile = new RandomAccessFile(file, "r");
        this.postingsFileName = file.getName();
        try {
            this.dataLength = StorageFileUtil.verifyCrc32Footer(randomAccessFile, postingsFileName);
            randomAccessFile.seek(0L);
            int magic = randomAccessFile.readInt();
            if (magic != Constants.POSTINGS_MAGIC) {
                throw new IOException("倒排文件 magic 不匹配: " + postingsFileName);
            }
            short version = randomAccessFile.readShort();
            if (version != Constants.FORMAT_VERSION) {
                throw new IOException("倒排文件版本不支持: " + version);
            }
        } catch (IOException exception) {
            randomAccessFile.close();
            throw exception;
        }
    }

    /**
     * 从指定偏移读取一条倒排列表。
     *
     * @param offset 倒排列表偏移
     * @return 解码后的倒排列表
     * @throws IOException 读取或解码失败时抛出
     */
    public PostingList readPostingList(long offset) throws IOException {
        int[][] block = readBlock(offset);
        try {
            return new PostingList(block[0], block[1]);
        } catch (IllegalArgumentException exception) {
            throw new IOException("倒排列表内容非法: offset=" + offset + ", file=" + postingsFileName, exception);
        }
    }

    /**
     * 从指定偏移读取行长度表。
     */
    public RowLengths readRowLengths(long offset) throws IOException {
        int[][] block = readBlock(offset);
        return new RowLengths(block[0], block[1]);
    }

    private int[][] readBlock(long offset) throws IOException {
        ensureOpen();
        if (offset < HEADER_LENGTH || offset >= dataLength) {
            throw new IOException("无效倒排偏移: " + offset + ", file=" + postingsFileName);
        }

        randomAccessFile.seek(offset);
        int rowCount = StorageFileUtil.readVarInt(randomAccessFile);
        if (rowCount < 0) {
            throw new IOException("倒排块计数非法: rowCount=" + rowCount + ", offset=" + offset);
        }

        int[] deltas = new int[rowCount];
        for (int index = 0; index < rowCount; index++) {
            deltas[index] = StorageFileUtil.readVarInt(randomAccessFile);
            if (deltas[index] < 0) {
                throw new IOException("rowIdx delta非法: index=" + index + ", offset=" + offset);
            }
        }
        int[] values = new int[rowCount];
        for (int index = 0; index < rowCount; index++) {
            values[index] = StorageFileUtil.readVarInt(randomAccessFile);
            if (values[index] < 0) {
                throw new IOException("取值非法: index=" + index + ", offset=" + offset);
            }
        }
        if (randomAccessFile.getFilePointer() > dataLength) {
            throw new IOException("倒排块越过数据区: offset=" + offset + ", file=" + postingsFileName);
        }
        return new int[][] {DeltaCodec.decode(deltas), values};
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        randomAccessFile.close();
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("PostingsReader 已关闭");
        }
    }
}
