package com.datasetsearch.job;

import com.datasetsearch.config.Constants;
import com.datasetsearch.config.EngineConfig;
import com.datasetsearch.dataset.DatasetCatalog;
import com.datasetsearch.dataset.RowSource;
import com.datasetsearch.dataset.SplitExport;
import com.datasetsearch.error.DatasetSearchException;
import com.datasetsearch.error.ErrorCode;
import com.datasetsearch.error.StreamReadException;
import com.datasetsearch.error.UnsupportedDatasetException;
import com.datasetsearch.extract.TextExtractor;
import com.datasetsearch.index.IndexBuilder;
import com.datasetsearch.index.IndexStore;
import com.datasetsearch.index.InvertedIndex;
import com.datasetsearch.index.PublishedIndex;
import com.datasetsearch.index.SplitKey;
import com.datasetsearch.index.StagedIndex;
import com.datasetsearch.query.BuildTrigger;
import com.datasetsearch.row.CellValues;
import com.datasetsearch.row.RowTable;
import com.datasetsearch.row.SourceRow;
import com.datasetsearch.row.StoredRow;
import com.datasetsearch.schema.Features;
import com.datasetsearch.text.PorterStemmingTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 建索引服务：在固定线程池上构建 split 索引并发布。
 *
 * 不同 split 的构建互不共享可变状态，可以完全并行；同一 split 正在构建时的重复请求合并到同一个 future。
 */
public class IndexingService implements BuildTrigger, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(IndexingService.class);

    private final EngineConfig config;
    private final DatasetCatalog catalog;
    private final IndexStore indexStore;
    private final PorterStemmingTokenizer tokenizer;
    private final TextExtractor extractor = new TextExtractor();
    private final ExecutorService executor;
    private final Map<SplitKey, CompletableFuture<PublishedIndex>> inFlight = new ConcurrentHashMap<>();

    public IndexingService(EngineConfig config, DatasetCatalog catalog, IndexStore indexStore) {
        this.config = config;
        this.catalog = catalog;
        this.indexStore = indexStore;
        this.tokenizer = new PorterStemmingTokenizer(config.isStopWordsEnabled());
        int threads = Math.max(1, Math.min(config.getIndexThreads(), Constants.MAX_INDEX_THREADS));
        this.executor = Executors.newFixedThreadPool(threads, new IndexThreadFactory());
    }

    /**
     * 提交 split 的构建任务。同一 split 已在构建中时返回进行中的 future。
     */
    public CompletableFuture<PublishedIndex> submit(SplitKey key) {
        CompletableFuture<PublishedIndex> created = new CompletableFuture<>();
        CompletableFuture<PublishedIndex> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            logger.debug("合并重复的构建请求: split={}", key);
            return existing;
        }
        try {
            executor.execute(() -> runBuild(key, created));
        } catch (RejectedExecutionException exception) {
            inFlight.remove(key, created);
            created.completeExceptionally(exception);
        }
        return created;
    }

    @Override
    public void requestBuild(SplitKey key) {
        submit(key);
    }

    public boolean isBuilding(SplitKey key) {
        return inFlight.containsKey(key);
    }

    private void runBuild(SplitKey key, CompletableFuture<PublishedIndex> future) {
        try {
            PublishedIndex published = build(key);
            // 先移除再完成，等待方拿到结果后再次提交会触发新的构建
            inFlight.remove(key, future);
            future.complete(published);
        } catch (Throwable throwable) {
            logger.error("索引构建失败: split={}", key, throwable);
            inFlight.remove(key, future);
            future.completeExceptionally(throwable);
            // Error 交给线程的未捕获处理器，等待方已经通过 future 得到失败
            if (throwable instanceof Error error) {
                throw error;
            }
        }
    }

    /**
     * 同步构建并发布一个 split 的索引。失败时暂存版本被丢弃，已发布版本不受影响。
     */
    PublishedIndex build(SplitKey key) {
        long startNanos = System.nanoTime();
        SplitExport export = catalog.locate(key);
        Features features = export.readFeatures();
        if (!features.hasIndexableColumns()) {
            throw new UnsupportedDatasetException(ErrorCode.NO_INDEXABLE_COLUMNS, "split 没有可索引的字符串列: " + key);
        }
        logger.info("开始构建索引: split={}, columns={}, budget={}", key, features.indexableColumns(), config.getByteBudget());

        StagedIndex staged;
        try {
            staged = indexStore.beginVersion(key);
        } catch (IOException exception) {
            throw new StreamReadException("无法创建索引版本目录: split=" + key, exception);
        }
        try {
            InvertedIndex index = buildWithRowStore(export, features, staged);
            PublishedIndex published = indexStore.publish(staged, index, features);
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            logger.info("索引构建并发布完成: split={}, version={}, 耗时={}ms", key, published.version(), elapsedMs);
            return published;
        } catch (IOException exception) {
            staged.discard();
            throw new StreamReadException("写入索引失败: split=" + key, exception);
        } catch (RuntimeException | Error exception) {
            staged.discard();
            throw exception;
        }
    }

    private InvertedIndex buildWithRowStore(SplitExport export, Features features, StagedIndex staged) throws IOException {
        IndexBuilder builder = new IndexBuilder(tokenizer, extractor, config.getByteBudget());
        try (RowSource rows = export.openRows(); RowTable rowTable = new RowTable(staged.rowStorePath())) {
            List<StoredRow> batch = new ArrayList<>(Constants.ROW_STORE_BATCH_SIZE);
            InvertedIndex index = builder.build(rows, features, row -> {
                batch.add(toStoredRow(row));
                if (batch.size() >= Constants.ROW_STORE_BATCH_SIZE) {
                    rowTable.insertAll(batch);
                    batch.clear();
                }
            });
            rowTable.insertAll(batch);
            return index;
        } catch (IllegalStateException exception) {
            throw new IOException("写入行存储失败: split=" + export.key(), exception);
        }
    }

    private StoredRow toStoredRow(SourceRow row) {
        return new StoredRow(row.rowIndex(), CellValues.rowToJson(row.cells()).toString());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("建索引线程池未在30秒内结束，强制关闭");
                executor.shutdownNow();
            }
        } catch (InterruptedException exception) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 为建索引线程命名，便于日志定位。
     */
    private static final class IndexThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "index-builder-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    /**
     * 将 CompletableFuture 的包装异常还原为业务异常。
     */
    public static DatasetSearchException unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof DatasetSearchException datasetSearchException) {
            return datasetSearchException;
        }
        return new StreamReadException("索引构建失败: " + cause.getMessage(), cause);
    }
}
