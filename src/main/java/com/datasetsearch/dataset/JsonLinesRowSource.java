package com.datasetsearch.dataset;

import com.datasetsearch.row.CellValue;
import com.datasetsearch.row.CellValues;
import com.datasetsearch.row.SourceRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * 读取 JSON Lines 导出的行流，第 N 行（从0开始）即 row_idx=N。
 *
 * 行的字节数是它在文件中实际占用的字节，含 {@code \n} 或 {@code \r\n} 结束符；末行没有结束符时不额外计数。
 * 无法解析的行以 malformed 形式返回，由调用方决定跳过。
 */
public class JsonLinesRowSource implements RowSource {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path file;
    private final InputStream input;
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream(256);
    private int nextRowIndex;

    public JsonLinesRowSource(Path file) throws IOException {
        this.file = file;
        this.input = new BufferedInputStream(Files.newInputStream(file), BUFFER_SIZE);
    }

    @Override
    public Optional<SourceRow> next() throws IOException {
        RawLine rawLine;
        try {
            rawLine = readRawLine();
        } catch (IOException exception) {
            throw new IOException("读取行流失败: file=" + file + ", rowIdx=" + nextRowIndex, exception);
        }
        if (rawLine == null) {
            return Optional.empty();
        }
        int rowIndex = nextRowIndex++;
        String line = rawLine.text();
        if (line.isBlank()) {
            return Optional.of(SourceRow.malformed(rowIndex, rawLine.byteSize(), "空行"));
        }
        try {
            Map<String, CellValue> cells = CellValues.rowFromJson(OBJECT_MAPPER.readTree(line));
            return Optional.of(SourceRow.of(rowIndex, rawLine.byteSize(), cells));
        } catch (JsonProcessingException exception) {
            return Optional.of(SourceRow.malformed(rowIndex, rawLine.byteSize(), "JSON 解析失败: " + exception.getOriginalMessage()));
        } catch (IllegalArgumentException exception) {
            return Optional.of(SourceRow.malformed(rowIndex, rawLine.byteSize(), exception.getMessage()));
        }
    }

    /**
     * 读到 {@code \n} 或文件末尾为止，文件已读完时返回 null。
     */
    private RawLine readRawLine() throws IOException {
        lineBuffer.reset();
        long byteSize = 0;
        int next;
        while ((next = input.read()) != -1) {
            byteSize++;
            if (next == '\n') {
                break;
            }
            lineBuffer.write(next);
        }
        if (byteSize == 0) {
            return null;
        }
        byte[] bytes = lineBuffer.toByteArray();
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        return new RawLine(new String(bytes, 0, length, StandardCharsets.UTF_8), byteSize);
    }

    @Override
    public void close() throws IOException {
        input.close();
    }

    private record RawLine(String text, long byteSize) {
    }
}
