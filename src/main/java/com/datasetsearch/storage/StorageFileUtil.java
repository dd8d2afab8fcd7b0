package com.datasetsearch.storage;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.zip.CRC32;

/**
 * 索引文件共用的随机访问读写工具：VarInt 与 CRC32 页脚。
 */
final class StorageFileUtil {
    private static final int CRC_BUFFER_SIZE = 8 * 1024;

    private StorageFileUtil() {
    }

    static void writeVarInt(RandomAccessFile file, int value) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(5);
        VarIntCodec.writeVarInt(value, buffer);
        file.write(buffer.toByteArray());
    }

    static int readVarInt(RandomAccessFile file) throws IOException {
        int result = 0;
        for (int shift = 0; shift < 32; shift += 7) {
            int currentByte = file.read();
            if (currentByte == -1) {
                throw new EOFException("读取 VarInt 时遇到 EOF, pointer=" + file.getFilePointer());
            }
            result |= (currentByte & 0x7F) << shift;
            if ((currentByte & 0x80) == 0) {
                return result;
            }
        }
        throw new IOException("VarInt 超过 32 位范围, pointer=" + file.getFilePointer());
    }

    /**
     * 计算文件前 length 字节的 CRC32，不改变文件指针。
     */
    static long computeCrc32(RandomAccessFile file, long length) throws IOException {
        long originalPointer = file.getFilePointer();
        CRC32 crc32 = new CRC32();
        byte[] buffer = new byte[CRC_BUFFER_SIZE];
        long remainingBytes = length;
        file.seek(0L);
        while (remainingBytes > 0) {
            int readBytes = file.read(buffer, 0, (int) Math.min(buffer.length, remainingBytes));
            if (readBytes < 0) {
                throw new EOFException("计算 CRC32 时遇到 EOF, remaining=" + remainingBytes);
            }
            crc32.update(buffer, 0, readBytes);
            remainingBytes -= readBytes;
        }
        file.seek(originalPointer);
        return crc32.getValue();
    }

    static void appendCrc32Footer(RandomAccessFile file) throws IOException {
        long dataLength = file.length();
        long crc32Value = computeCrc32(file, dataLength);
        file.seek(dataLength);
        file.writeInt((int) crc32Value);
    }

    /**
     * 校验尾部 CRC32 并返回不含页脚的数据区长度。
     */
    static long verifyCrc32Footer(RandomAccessFile file, String fileName) throws IOException {
        long fileLength = file.length();
        if (fileLength < Integer.BYTES) {
            throw new IOException("文件过短，缺少 CRC32 页脚: " + fileName);
        }
        long dataLength = fileLength - Integer.BYTES;
        file.seek(dataLength);
        long expectedCrc32 = Integer.toUnsignedLong(file.readInt());
        long actualCrc32 = computeCrc32(file, dataLength);
        if (actualCrc32 != expectedCrc32) {
            throw new IOException("CRC32 校验失败: " + fileName + ", expected=" + expectedCrc32 + ", actual=" + actualCrc32);
        }
        return dataLength;
    }
}
