package com.datasetsearch.index;

import com.datasetsearch.error.RowStoreException;
import com.datasetsearch.schema.Features;
import com.datasetsearch.storage.DictionaryReader;
import com.datasetsearch.storage.DictionaryWriter;
import com.datasetsearch.storage.PostingList;
import com.datasetsearch.storage.PostingsReader;
import com.datasetsearch.storage.PostingsWriter;
import com.datasetsearch.storage.RowLengths;
import com.datasetsearch.storage.TermEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于文件系统的索引存储。
 *
 * 目录结构：{@code <root>/<dataset>/<config>/<split>/v<N>/}，同级的 CURRENT 文件指向当前版本。
 * 发布时先写临时指针再原子 rename，读者要么看到旧版本要么看到新版本。
 */
public class FileIndexStore implements IndexStore {
    private static final Logger logger = LoggerFactory.getLogger(FileIndexStore.class);

    private final Path root;
    private final int retainedVersions;
    private final Map<SplitKey, PublishedIndex> cache = new ConcurrentHashMap<>();

    public FileIndexStore(Path root, int retainedVersions) {
        if (retainedVersions < 1) {
            throw new IllegalArgumentException("retainedVersions 至少为1: " + retainedVersions);
        }
        this.root = root.toAbsolutePath().normalize();
        this.retainedVersions = retainedVersions;
    }

    @Override
    public synchronized StagedIndex beginVersion(SplitKey key) throws IOException {
        Path splitDir = splitDirectory(key);
        Files.createDirectories(splitDir);
        int version = listVersions(key).stream().max(Integer::compare).orElse(0) + 1;
        while (true) {
            Path versionDir = splitDir.resolve(IndexFiles.VERSION_PREFIX + version);
            try {
                Files.createDirectory(versionDir);
                logger.debug("分配索引版本: split={}, version={}", key, version);
                return new StagedIndex(key, version, versionDir);
            } catch (FileAlreadyExistsException exception) {
                version++;
            }
        }
    }

    @Override
    public PublishedIndex publish(StagedIndex staged, InvertedIndex index, Features features) throws IOException {
        Path versionDir = staged.directory();
        long rowLengthsOffset = writeIndexFiles(versionDir, index);
        features.write(versionDir.resolve(IndexFiles.FEATURES));
        IndexMeta meta = IndexMeta.of(staged.key(), staged.version(), index, rowLengthsOffset, Instant.now());
        meta.writeTo(versionDir.resolve(IndexFiles.META).toFile());

        PublishedIndex published = new PublishedIndex(staged.key(), staged.version(), versionDir, index, features, meta);
        synchronized (this) {
            switchCurrent(staged.key(), staged.version());
            cache.put(staged.key(), published);
        }
        logger.info("索引已发布: split={}, version={}, rows={}, terms={}, partial={}",
            staged.key(), staged.version(), index.rowsIndexed(), index.termCount(), index.isPartial());
        removeExpiredVersions(staged.key(), staged.version());
        return published;
    }

    @Override
    public Optional<PublishedIndex> find(SplitKey key) {
        try {
            Optional<Integer> currentVersion = readCurrentVersion(key);
            if (currentVersion.isEmpty()) {
                cache.remove(key);
                return Optional.empty();
            }
            int version = currentVersion.get();
            PublishedIndex cached = cache.get(key);
            if (cached != null && cached.version() == version) {
                return Optional.of(cached);
            }
            PublishedIndex loaded = load(key, version);
            cache.merge(key, loaded, (existing, candidate) -> existing.version() >= candidate.version() ? existing : candidate);
            return Optional.of(loaded);
        } catch (IOException exception) {
            throw new RowStoreException("读取索引失败: split=" + key, exception);
        }
    }

    /**
     * 列出磁盘上该 split 的全部版本号（含未发布的暂存版本），升序。
     */
    public List<Integer> listVersions(SplitKey key) throws IOException {
        Path splitDir = splitDirectory(key);
        List<Integer> versions = new ArrayList<>();
        if (!Files.isDirectory(splitDir)) {
            return versions;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(splitDir, IndexFiles.VERSION_PREFIX + "*")) {
            for (Path entry : entries) {
                parseVersion(entry.getFileName().toString()).ifPresent(versions::add);
            }
        }
        versions.sort(Comparator.naturalOrder());
        return versions;
    }

    public Path getRoot() {
        return root;
    }

    Path splitDirectory(SplitKey key) {
        return root.resolve(key.relativePath());
    }

    private long writeIndexFiles(Path versionDir, InvertedIndex index) throws IOException {
        Map<String, Long> offsets = new TreeMap<>();
        long rowLengthsOffset;
        try (PostingsWriter postingsWriter = new PostingsWriter(versionDir.resolve(IndexFiles.POSTINGS).toFile())) {
            for (Map.Entry<String, PostingList> entry : index.allPostings().entrySet()) {
                offsets.put(entry.getKey(), postingsWriter.writePostingList(entry.getValue()));
            }
            rowLengthsOffset = postingsWriter.writeRowLengths(index.rowLengths());
        }
        try (DictionaryWriter dictionaryWriter = new DictionaryWriter(versionDir.resolve(IndexFiles.DICTIONARY).toFile())) {
            for (Map.Entry<String, Long> entry : offsets.entrySet()) {
                dictionaryWriter.writeTermEntry(entry.getKey(), index.rowFrequency(entry.getKey()), entry.getValue());
            }
        }
        return rowLengthsOffset;
    }

    private PublishedIndex load(SplitKey key, int version) throws IOException {
        Path versionDir = splitDirectory(key).resolve(IndexFiles.VERSION_PREFIX + version);
        IndexMeta meta = IndexMeta.readFrom(versionDir.resolve(IndexFiles.META).toFile());
        Features features = Features.read(versionDir.resolve(IndexFiles.FEATURES));
        DictionaryReader dictionaryReader = new DictionaryReader(versionDir.resolve(IndexFiles.DICTIONARY).toFile());

        Map<String, PostingList> postings = new TreeMap<>();
        RowLengths rowLengths;
        try (PostingsReader postingsReader = new PostingsReader(versionDir.resolve(IndexFiles.POSTINGS).toFile())) {
            for (TermEntry entry : dictionaryReader.entries()) {
                PostingList postingList = postingsReader.readPostingList(entry.postingsOffset());
                if (postingList.size() != entry.rowFreq()) {
                    throw new IOException("词典与倒排不一致: term=" + entry.term()
                        + ", rowFreq=" + entry.rowFreq() + ", postings=" + postingList.size());
                }
                postings.put(entry.term(), postingList);
            }
            rowLengths = postingsReader.readRowLengths(meta.rowLengthsOffset());
        }
        InvertedIndex index = new InvertedIndex(postings, rowLengths, meta.columnLengths(), meta.partial(),
            meta.consumedBytes(), meta.byteBudget(), meta.rowsSkipped());
        logger.debug("已加载索引: split={}, version={}, terms={}", key, version, index.termCount());
        return new PublishedIndex(key, version, versionDir, index, features, meta);
    }

    private Optional<Integer> readCurrentVersion(SplitKey key) throws IOException {
        Path currentFile = splitDirectory(key).resolve(IndexFiles.CURRENT);
        String content;
        try {
            content = Files.readString(currentFile, StandardCharsets.UTF_8).trim();
        } catch (NoSuchFileException exception) {
            return Optional.empty();
        }
        Optional<Integer> version = parseVersion(content);
        if (version.isEmpty()) {
            throw new IOException("CURRENT 文件内容非法: " + content + ", file=" + currentFile);
        }
        return version;
    }

    private void switchCurrent(SplitKey key, int version) throws IOException {
        Path splitDir = splitDirectory(key);
        Path tempFile = splitDir.resolve(IndexFiles.CURRENT + ".tmp");
        Files.writeString(tempFile, IndexFiles.VERSION_PREFIX + version, StandardCharsets.UTF_8);
        Files.move(tempFile, splitDir.resolve(IndexFiles.CURRENT),
            StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * 删除比当前版本旧、且超出保留数量的版本。比当前版本新的暂存目录属于进行中的构建，不动。
     */
    private void removeExpiredVersions(SplitKey key, int currentVersion) {
        try {
            List<Integer> olderOrCurrent = listVersions(key).stream()
                .filter(version -> version <= currentVersion)
                .sorted(Comparator.reverseOrder())
                .toList();
            for (int index = retainedVersions; index < olderOrCurrent.size(); index++) {
                int version = olderOrCurrent.get(index);
                StagedIndex.deleteRecursively(splitDirectory(key).resolve(IndexFiles.VERSION_PREFIX + version));
                logger.info("已清理旧索引版本: split={}, version={}", key, version);
            }
        } catch (IOException exception) {
            logger.warn("清理旧索引版本失败: split={}", key, exception);
        }
    }

    private static Optional<Integer> parseVersion(String name) {
        if (!name.startsWith(IndexFiles.VERSION_PREFIX)) {
            return Optional.empty();
        }
        try {
            int version = Integer.parseInt(name.substring(IndexFiles.VERSION_PREFIX.length()));
            return version > 0 ? Optional.of(version) : Optional.empty();
        } catch (NumberFormatException exception) {
            return Optional.empty();
        }
    }
}
