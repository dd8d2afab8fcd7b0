package com.datasetsearch.storage;

import com.datasetsearch.config.Constants;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 词典文件读取器，构造时全量加载并校验词条。
 */
public final class DictionaryReader {
    private final TreeMap<String, TermEntry> entriesByTerm = new TreeMap<>();

    /**
     * 构造读取器并完成词典全量加载。
     *
     * @param file 词典文件
     * @throws IOException 文件损坏或解析失败时抛出
     */
    public DictionaryReader(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("词典文件不能为空");
        }
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file, "r")) {
            long dataLength = StorageFileUtil.verifyCrc32Footer(randomAccessFile, file.getName());
            randomAccessFile.seek(0L);

            int magic = randomAccessFile.readInt();
            if (magic != Constants.DICT_MAGIC) {
                throw new IOException("词典文件 magic 不匹配: " + file.getName());
            }
            short version = randomAccessFile.readShort();
            if (version != Constants.FORMAT_VERSION) {
                throw new IOException("词典文件版本不支持: " + version);
            }

            int termCount = randomAccessFile.readInt();
            if (termCount < 0) {
                throw new IOException("词典termCount非法: " + termCount + ", file=" + file.getAbsolutePath());
            }
            String previousTerm = null;
            for (int index = 0; index < termCount; index++) {
                int termLength = StorageFileUtil.readVarInt(randomAccessFile);
                if (termLength <= 0) {
                    throw new IOException("词项长度非法: index=" + index + ", termLength=" + termLength);
                }
                byte[] termBytes = new byte[termLength];
                randomAccessFile.readFully(termBytes);
                String term = new String(termBytes, StandardCharsets.UTF_8);
                if (previousTerm != null && term.compareTo(previousTerm) <= 0) {
                    throw new IOException("词典词序损坏，term 未严格递增: " + term);
                }
                int rowFreq = StorageFileUtil.readVarInt(randomAccessFile);
                if (rowFreq < 1) {
                    throw new IOException("rowFreq非法: term=" + term + ", rowFreq=" + rowFreq);
                }
                long postingsOffset = randomAccessFile.readLong();
                if (postingsOffset < 0) {
                    throw new IOException("offset非法: term=" + term + ", postingsOffset=" + postingsOffset);
                }
                entriesByTerm.put(term, new TermEntry(term, rowFreq, postingsOffset));
                previousTerm = term;
            }

            if (randomAccessFile.getFilePointer() != dataLength) {
                throw new IOException("词典文件包含未解析字节，可能已损坏: " + file.getName());
            }
        }
    }

    /**
     * 精确查找词项对应词条。
     */
    public Optional<TermEntry> lookup(String term) {
        return Optional.ofNullable(entriesByTerm.get(term));
    }

    public int getTermCount() {
        return entriesByTerm.size();
    }

    /**
     * 按字典序返回全部词条。
     */
    public List<TermEntry> entries() {
        return new ArrayList<>(entriesByTerm.values());
    }
}
