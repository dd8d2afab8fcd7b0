package com.datasetsearch.config;

/**
 * 全局常量定义
 *
 * 包含存储格式魔数、索引预算、BM25参数与分页参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 存储格式魔数 ====================
    /** 词典文件魔数 "DSDI" */
    public static final int DICT_MAGIC = 0x44534449;
    /** 倒排列表文件魔数 "DSPI" */
    public static final int POSTINGS_MAGIC = 0x44535049;
    /** 文件格式版本号，v2 起倒排块不再带 skip 区 */
    public static final short FORMAT_VERSION = 2;

    // ==================== 索引参数 ====================
    /** 单个split建索引时允许消费的最大字节数（5GB） */
    public static final long DEFAULT_BYTE_BUDGET = 5_000_000_000L;
    /** 默认保留的索引版本数（当前版本 + 上一版本） */
    public static final int DEFAULT_RETAINED_VERSIONS = 2;
    /** 行存储批量写入大小 */
    public static final int ROW_STORE_BATCH_SIZE = 500;

    // ==================== BM25参数 ====================
    /** 词频饱和系数 */
    public static final double BM25_K1 = 1.2;
    /** 长度归一化系数 */
    public static final double BM25_B = 0.75;

    // ==================== 查询参数 ====================
    /** 每页最大行数，同时作为 length 默认值 */
    public static final int MAX_ROWS_PER_PAGE = 100;
    /** 查询字符串最大长度 */
    public static final int MAX_QUERY_LENGTH = 1024;

    // ==================== 线程参数 ====================
    /** 默认建索引线程数 */
    public static final int DEFAULT_INDEX_THREADS = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    /** 建索引线程数安全上限 */
    public static final int MAX_INDEX_THREADS = 32;
}
