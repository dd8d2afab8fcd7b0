package com.datasetsearch.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 存储层文件格式集成测试，覆盖词典/倒排/行长度写读一致性与 CRC 防护。
 */
class StorageRoundTripTest {

    @TempDir
    Path tempDir;

    /**
     * 验证词典文件写入读取一致性。
     */
    @Test
    void dictionaryRoundTrip() throws IOException {
        File dictionaryFile = tempDir.resolve("terms.dict").toFile();
        Map<String, TermEntry> expectedByTerm = new TreeMap<>();
        Random random = new Random(7);
        for (String term : List.of("app", "apple", "application", "apply", "banana", "cat", "dog")) {
            expectedByTerm.put(term, new TermEntry(term, random.nextInt(500) + 1, random.nextInt(1_000_000)));
        }

        try (DictionaryWriter writer = new DictionaryWriter(dictionaryFile)) {
            for (TermEntry entry : expectedByTerm.values()) {
                writer.writeTermEntry(entry.term(), entry.rowFreq(), entry.postingsOffset());
            }
        }

        DictionaryReader reader = new DictionaryReader(dictionaryFile);
        assertEquals(expectedByTerm.size(), reader.getTermCount());
        for (Map.Entry<String, TermEntry> entry : expectedByTerm.entrySet()) {
            Optional<TermEntry> found = reader.lookup(entry.getKey());
            assertTrue(found.isPresent());
            assertEquals(entry.getValue(), found.get());
        }
        assertTrue(reader.lookup("zebra").isEmpty());
        assertEquals(List.copyOf(expectedByTerm.values()), reader.entries());
    }

    /**
     * 词典写入要求词项严格递增。
     */
    @Test
    void dictionaryRejectsUnsortedTerms() throws IOException {
        File dictionaryFile = tempDir.resolve("unsorted.dict").toFile();
        try (DictionaryWriter writer = new DictionaryWriter(dictionaryFile)) {
            writer.writeTermEntry("beta", 1, 0L);
            assertThrows(IllegalArgumentException.class, () -> writer.writeTermEntry("alpha", 1, 10L));
            assertThrows(IllegalArgumentException.class, () -> writer.writeTermEntry("beta", 1, 10L));
            assertThrows(IllegalArgumentException.class, () -> writer.writeTermEntry("gamma", 0, 10L));
        }
    }

    /**
     * 验证倒排列表与行长度表在同一文件内的写读一致性。
     */
    @Test
    void postingsAndRowLengthsRoundTrip() throws IOException {
        File postingsFile = tempDir.resolve("postings.inv").toFile();
        Random random = new Random(11);
        int[] rowIndices = new int[350];
        int[] termFreqs = new int[350];
        int[] lengths = new int[350];
        int currentRow = 0;
        for (int index = 0; index < rowIndices.length; index++) {
            currentRow += random.nextInt(4) + 1;
            rowIndices[index] = currentRow;
            termFreqs[index] = random.nextInt(6) + 1;
            lengths[index] = random.nextInt(20);
        }
        PostingList large = new PostingList(rowIndices, termFreqs);
        PostingList small = new PostingList(new int[]{3}, new int[]{2});
        RowLengths rowLengths = new RowLengths(rowIndices, lengths);

        long largeOffset;
        long smallOffset;
        long rowLengthsOffset;
        try (PostingsWriter writer = new PostingsWriter(postingsFile)) {
            largeOffset = writer.writePostingList(large);
            smallOffset = writer.writePostingList(small);
            rowLengthsOffset = writer.writeRowLengths(rowLengths);
        }

        try (PostingsReader reader = new PostingsReader(postingsFile)) {
            assertEquals(small, reader.readPostingList(smallOffset));
            assertEquals(large, reader.readPostingList(largeOffset));
            assertEquals(rowLengths, reader.readRowLengths(rowLengthsOffset));
        }
    }

    /**
     * 倒排块只含行数、行号增量和词频，没有额外的跳表字节。
     */
    @Test
    void postingBlockHasNoSkipArea() throws IOException {
        File postingsFile = tempDir.resolve("compact.inv").toFile();
        int[] rowIndices = new int[300];
        int[] termFreqs = new int[300];
        for (int index = 0; index < rowIndices.length; index++) {
            rowIndices[index] = index;
            termFreqs[index] = 1;
        }

        long firstOffset;
        long secondOffset;
        try (PostingsWriter writer = new PostingsWriter(postingsFile)) {
            firstOffset = writer.writePostingList(new PostingList(rowIndices, termFreqs));
            secondOffset = writer.writePostingList(new PostingList(new int[]{0}, new int[]{1}));
        }

        // 行数 300 占 2 字节，增量与词频各占 1 字节
        assertEquals(2 + 300 + 300, secondOffset - firstOffset);
        try (PostingsReader reader = new PostingsReader(postingsFile)) {
            assertEquals(300, reader.readPostingList(firstOffset).size());
        }
    }

    /**
     * 空索引只有一个空的行长度表。
     */
    @Test
    void emptyRowLengthsRoundTrip() throws IOException {
        File postingsFile = tempDir.resolve("empty.inv").toFile();
        long offset;
        try (PostingsWriter writer = new PostingsWriter(postingsFile)) {
            offset = writer.writeRowLengths(new RowLengths(new int[0], new int[0]));
        }
        try (PostingsReader reader = new PostingsReader(postingsFile)) {
            assertEquals(0, reader.readRowLengths(offset).size());
        }
    }

    /**
     * 篡改任意数据字节后 CRC 校验失败。
     */
    @Test
    void corruptedFileDetectedByCrc() throws IOException {
        File dictionaryFile = tempDir.resolve("corrupt.dict").toFile();
        try (DictionaryWriter writer = new DictionaryWriter(dictionaryFile)) {
            writer.writeTermEntry("alpha", 2, 6L);
            writer.writeTermEntry("beta", 1, 20L);
        }
        try (RandomAccessFile file = new RandomAccessFile(dictionaryFile, "rw")) {
            file.seek(12);
            int original = file.read();
            file.seek(12);
            file.write(original ^ 0xFF);
        }

        IOException exception = assertThrows(IOException.class, () -> new DictionaryReader(dictionaryFile));
        assertTrue(exception.getMessage().contains("CRC32"));
    }

    /**
     * 越界偏移读取报错而不是返回垃圾数据。
     */
    @Test
    void invalidOffsetRejected() throws IOException {
        File postingsFile = tempDir.resolve("offset.inv").toFile();
        try (PostingsWriter writer = new PostingsWriter(postingsFile)) {
            writer.writePostingList(new PostingList(new int[]{1}, new int[]{1}));
        }
        try (PostingsReader reader = new PostingsReader(postingsFile)) {
            assertThrows(IOException.class, () -> reader.readPostingList(0L));
            assertThrows(IOException.class, () -> reader.readPostingList(10_000L));
        }
    }
}
