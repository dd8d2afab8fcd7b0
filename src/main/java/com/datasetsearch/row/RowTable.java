package com.datasetsearch.row;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个索引版本的行存储，保存已入索引行的完整 JSON 内容。
 */
public final class RowTable implements AutoCloseable {
    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS split_rows (
                row_idx INTEGER PRIMARY KEY,
                content TEXT NOT NULL
            )
            """;

    private static final String ENABLE_WAL_SQL = "PRAGMA journal_mode=WAL";
    private static final String INSERT_SQL = "INSERT OR REPLACE INTO split_rows(row_idx, content) VALUES (?, ?)";
    private static final int MAX_IN_CLAUSE = 500;

    private final Connection connection;
    private final Path dbPath;

    /**
     * 打开（必要时创建）行存储。
     */
    public RowTable(Path dbPath) {
        this.dbPath = dbPath;
        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
            initializeSchema();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("初始化行存储失败: " + dbPath, sqlException);
        }
    }

    /**
     * 在单个事务内批量写入行。
     */
    public void insertAll(Collection<StoredRow> rows) {
        if (rows.isEmpty()) {
            return;
        }
        try {
            boolean previousAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try (PreparedStatement preparedStatement = connection.prepareStatement(INSERT_SQL)) {
                for (StoredRow row : rows) {
                    preparedStatement.setInt(1, row.rowIndex());
                    preparedStatement.setString(2, row.content());
                    preparedStatement.addBatch();
                }
                preparedStatement.executeBatch();
                connection.commit();
            } catch (SQLException sqlException) {
                connection.rollback();
                throw sqlException;
            } finally {
                connection.setAutoCommit(previousAutoCommit);
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("批量写入行失败, count=" + rows.size() + ", db=" + dbPath, sqlException);
        }
    }

    /**
     * 按行号批量查找，结果按行号升序。不存在的行号不出现在结果中。
     */
    public Map<Integer, String> findByRowIndices(List<Integer> rowIndices) {
        Map<Integer, String> contents = new LinkedHashMap<>();
        for (int start = 0; start < rowIndices.size(); start += MAX_IN_CLAUSE) {
            List<Integer> chunk = rowIndices.subList(start, Math.min(rowIndices.size(), start + MAX_IN_CLAUSE));
            String placeholders = String.join(",", Collections.nCopies(chunk.size(), "?"));
            String sql = "SELECT row_idx, content FROM split_rows WHERE row_idx IN (" + placeholders + ") ORDER BY row_idx";
            try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
                for (int index = 0; index < chunk.size(); index++) {
                    preparedStatement.setInt(index + 1, chunk.get(index));
                }
                try (ResultSet resultSet = preparedStatement.executeQuery()) {
                    while (resultSet.next()) {
                        contents.put(resultSet.getInt(1), resultSet.getString(2));
                    }
                }
            } catch (SQLException sqlException) {
                throw new IllegalStateException("批量查询行失败, db=" + dbPath, sqlException);
            }
        }
        return contents;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("关闭行存储失败: " + dbPath, sqlException);
        }
    }

    private void initializeSchema() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(ENABLE_WAL_SQL);
            statement.execute(CREATE_TABLE_SQL);
        }
    }
}
