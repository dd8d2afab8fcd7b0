package com.datasetsearch.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * 构建中的索引版本目录。发布前对读者不可见，构建失败时整体删除。
 */
public final class StagedIndex {
    private static final Logger logger = LoggerFactory.getLogger(StagedIndex.class);

    private final SplitKey key;
    private final int version;
    private final Path directory;

    StagedIndex(SplitKey key, int version, Path directory) {
        this.key = key;
        this.version = version;
        this.directory = directory;
    }

    public SplitKey key() {
        return key;
    }

    public int version() {
        return version;
    }

    public Path directory() {
        return directory;
    }

    public Path rowStorePath() {
        return directory.resolve(IndexFiles.ROWS_DB);
    }

    /**
     * 丢弃未发布的版本目录。删除失败只记日志，不影响已发布的版本。
     */
    public void discard() {
        try {
            deleteRecursively(directory);
            logger.info("已丢弃未发布的索引版本: split={}, version={}", key, version);
        } catch (IOException | UncheckedIOException exception) {
            logger.warn("丢弃索引版本目录失败: dir={}", directory, exception);
        }
    }

    static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
