package com.datasetsearch.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * VarInt变长整数编解码器
 *
 * 编码规则：每字节7位有效数据，最高位为续接标志
 * - 最高位为1：表示后续还有字节
 * - 最高位为0：表示这是最后一个字节
 */
public final class VarIntCodec {

    private VarIntCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 将int值编码为VarInt并写入输出流
     *
     * @param value 要编码的值（必须非负）
     * @param out 输出流
     * @throws IOException IO异常
     * @throws IllegalArgumentException 如果value为负数
     */
    public static void writeVarInt(int value, OutputStream out) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }
        while ((value & ~0x7F) != 0) {
            out.write((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out.write(value & 0x7F);
    }

    /**
     * 从输入流读取VarInt并解码为int
     *
     * @param in 输入流
     * @return 解码后的值，流在首字节处结束返回-1
     * @throws IOException 流在VarInt中途结束或超过32位时抛出
     */
    public static int readVarInt(InputStream in) throws IOException {
        int result = 0;
        int shift = 0;
        while (shift < 32) {
            int b = in.read();
            if (b == -1) {
                if (shift == 0) {
                    return -1;
                }
                throw new IOException("VarInt不完整，流提前结束");
            }
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
        }
        throw new IOException("VarInt超过32位范围");
    }
}
