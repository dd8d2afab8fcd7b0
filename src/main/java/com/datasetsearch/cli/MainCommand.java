package com.datasetsearch.cli;

import com.datasetsearch.config.Constants;
import com.datasetsearch.config.EngineConfig;
import com.datasetsearch.dataset.DatasetCatalog;
import com.datasetsearch.error.DatasetSearchException;
import com.datasetsearch.index.FileIndexStore;
import com.datasetsearch.index.IndexMeta;
import com.datasetsearch.index.PublishedIndex;
import com.datasetsearch.index.SplitKey;
import com.datasetsearch.job.IndexingService;
import com.datasetsearch.query.QueryExecutor;
import com.datasetsearch.query.SearchRequest;
import com.datasetsearch.query.SearchResponse;
import com.datasetsearch.query.SqliteRowStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

@Command(
    name = "dse",
    description = "🔍 数据集 split 全文搜索（BM25）",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.IndexSubcommand.class,
        MainCommand.SearchSubcommand.class,
        MainCommand.StatusSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    static final int EXIT_FAILURE = 1;
    static final int EXIT_BAD_REQUEST = 2;
    static final int EXIT_NOT_READY = 3;

    @Option(names = {"--config"}, description = "properties 配置文件路径")
    private Path configFile;

    @Option(names = {"--datasets-dir"}, description = "数据集导出根目录")
    private Path datasetsDir;

    @Option(names = {"--index-dir"}, description = "索引目录路径")
    private Path indexDir;

    @Option(names = {"--byte-budget"}, description = "单个 split 建索引的字节预算")
    private Long byteBudget;

    @Option(names = {"--threads"}, description = "索引线程数")
    private Integer threads;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 数据集 split 全文搜索（BM25）");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 合并配置文件与命令行参数，命令行优先。
     */
    EngineConfig resolveConfig() throws IOException {
        EngineConfig config = configFile == null ? EngineConfig.defaults() : EngineConfig.load(configFile);
        if (datasetsDir != null) {
            config.setDatasetsDir(datasetsDir);
        }
        if (indexDir != null) {
            config.setIndexDir(indexDir);
        }
        if (byteBudget != null) {
            config.setByteBudget(byteBudget);
        }
        if (threads != null) {
            config.setIndexThreads(resolveThreadCount(threads));
        }
        return config;
    }

    private int resolveThreadCount(int requested) {
        if (requested <= 0) {
            System.err.printf("⚠️ 非法线程数 %d，已回退为默认值 %d%n", requested, Constants.DEFAULT_INDEX_THREADS);
            return Constants.DEFAULT_INDEX_THREADS;
        }
        if (requested > Constants.MAX_INDEX_THREADS) {
            System.err.printf("⚠️ 线程数 %d 超过安全上限 %d，已自动限制%n", requested, Constants.MAX_INDEX_THREADS);
            return Constants.MAX_INDEX_THREADS;
        }
        return requested;
    }

    static int exitCodeFor(DatasetSearchException exception) {
        return switch (exception.getErrorCode()) {
            case BAD_REQUEST -> EXIT_BAD_REQUEST;
            case INDEX_NOT_READY -> EXIT_NOT_READY;
            default -> EXIT_FAILURE;
        };
    }

    static void printError(String action, DatasetSearchException exception) {
        System.err.println("❌ " + action + ": " + exception.getMessage());
        System.err.println("   错误码: " + exception.getErrorCode() + (exception.isRetryable() ? "（可重试）" : ""));
    }

    @Command(name = "index", description = "📂 为一个 split 构建索引")
    static class IndexSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "数据集名")
        private String dataset;

        @Parameters(index = "1", description = "配置名")
        private String config;

        @Parameters(index = "2", description = "split 名")
        private String split;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig engineConfig = main.resolveConfig();
                SplitKey key = new SplitKey(dataset, config, split);
                System.out.println("🚀 开始索引: " + key);
                System.out.println("📁 索引目录: " + engineConfig.getIndexDir());
                System.out.println("📂 数据集目录: " + engineConfig.getDatasetsDir());

                FileIndexStore indexStore = new FileIndexStore(engineConfig.getIndexDir(), engineConfig.getRetainedVersions());
                try (IndexingService indexingService = new IndexingService(engineConfig,
                        new DatasetCatalog(engineConfig.getDatasetsDir()), indexStore)) {
                    long start = System.currentTimeMillis();
                    PublishedIndex published = indexingService.submit(key).join();
                    long elapsed = System.currentTimeMillis() - start;
                    IndexMeta meta = published.meta();

                    System.out.println("✅ 索引完成！");
                    System.out.println("📊 统计:");
                    System.out.println("   版本: v" + meta.version());
                    System.out.println("   行数: " + meta.rowsIndexed() + "（跳过 " + meta.rowsSkipped() + "）");
                    System.out.println("   词条数: " + meta.termCount());
                    System.out.println("   已消费字节: " + meta.consumedBytes() + " / " + meta.byteBudget());
                    if (meta.partial()) {
                        System.out.println("⚠️ 字节预算耗尽，索引只覆盖前缀行");
                    }
                    System.out.println("   用时: " + elapsed + "ms");
                    return 0;
                }
            } catch (CompletionException exception) {
                DatasetSearchException cause = IndexingService.unwrap(exception);
                printError("索引失败", cause);
                return exitCodeFor(cause);
            } catch (DatasetSearchException exception) {
                printError("索引失败", exception);
                return exitCodeFor(exception);
            } catch (IOException | IllegalArgumentException exception) {
                System.err.println("❌ 索引失败: " + exception.getMessage());
                return EXIT_FAILURE;
            }
        }
    }

    @Command(name = "search", description = "🔎 在 split 中搜索，输出 JSON")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "数据集名")
        private String dataset;

        @Parameters(index = "1", description = "配置名")
        private String config;

        @Parameters(index = "2", description = "split 名")
        private String split;

        @Parameters(index = "3", description = "查询语句")
        private String query;

        @Option(names = {"-o", "--offset"}, description = "起始行，默认0")
        private Integer offset;

        @Option(names = {"-n", "--length"}, description = "返回行数，1-100，默认100")
        private Integer length;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig engineConfig = main.resolveConfig();
                SearchRequest request = SearchRequest.of(dataset, config, split, query, offset, length);
                FileIndexStore indexStore = new FileIndexStore(engineConfig.getIndexDir(), engineConfig.getRetainedVersions());
                // 命令行没有常驻构建服务，只提示用户先建索引
                QueryExecutor executor = new QueryExecutor(indexStore, new SqliteRowStore(),
                    key -> System.err.println("💡 请先执行: dse index " + key.dataset() + " " + key.config() + " " + key.split()),
                    engineConfig);
                printJsonResult(executor.execute(request));
                return 0;
            } catch (DatasetSearchException exception) {
                printError("搜索失败", exception);
                return exitCodeFor(exception);
            } catch (IOException | IllegalArgumentException exception) {
                System.err.println("❌ 搜索失败: " + exception.getMessage());
                return EXIT_FAILURE;
            }
        }

        private void printJsonResult(SearchResponse response) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
        }
    }

    @Command(name = "status", description = "📊 查看 split 的索引状态")
    static class StatusSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "数据集名")
        private String dataset;

        @Parameters(index = "1", description = "配置名")
        private String config;

        @Parameters(index = "2", description = "split 名")
        private String split;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig engineConfig = main.resolveConfig();
                SplitKey key = new SplitKey(dataset, config, split);
                FileIndexStore indexStore = new FileIndexStore(engineConfig.getIndexDir(), engineConfig.getRetainedVersions());
                Optional<IndexMeta> status = indexStore.find(key).map(PublishedIndex::meta);
                if (status.isEmpty()) {
                    System.out.println("⚠️ 尚未建立索引: " + key);
                    return EXIT_NOT_READY;
                }
                IndexMeta meta = status.get();
                System.out.println("📊 索引状态");
                System.out.println("═══════════");
                System.out.println("📁 split: " + key);
                System.out.println("🏷️ 版本: v" + meta.version());
                System.out.println("📄 行数: " + meta.rowsIndexed() + "（跳过 " + meta.rowsSkipped() + "）");
                System.out.println("🔤 词条总数: " + meta.termCount());
                System.out.println("📏 平均行长度: " + String.format("%.2f", meta.averageRowLength()));
                System.out.println("💾 已消费: " + formatBytes(meta.consumedBytes()) + " / " + formatBytes(meta.byteBudget()));
                System.out.println("✂️ partial: " + meta.partial());
                System.out.println("🕒 构建时间: " + meta.createTime());
                return 0;
            } catch (DatasetSearchException exception) {
                printError("获取状态失败", exception);
                return exitCodeFor(exception);
            } catch (IOException | IllegalArgumentException exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return EXIT_FAILURE;
            }
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }
}
