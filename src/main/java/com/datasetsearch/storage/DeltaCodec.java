package com.datasetsearch.storage;

/**
 * Delta编码器
 *
 * 倒排列表中的行号严格递增，存相邻差值后配合VarInt可显著缩小文件。
 *
 * 示例：[10, 15, 20, 25] -> [10, 5, 5, 5]
 */
public final class DeltaCodec {

    private DeltaCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 对单调递增序列进行Delta编码
     *
     * @param sortedValues 非负单调递增序列
     * @return Delta编码后的数组
     * @throws IllegalArgumentException 如果输入非单调递增或为null
     */
    public static int[] encode(int[] sortedValues) {
        if (sortedValues == null) {
            throw new IllegalArgumentException("输入数组不能为null");
        }
        if (sortedValues.length == 0) {
            return new int[0];
        }
        for (int i = 1; i < sortedValues.length; i++) {
            if (sortedValues[i] < sortedValues[i - 1]) {
                throw new IllegalArgumentException("输入必须是非负单调递增序列，在位置 " + i + " 处违反");
            }
        }

        int[] deltas = new int[sortedValues.length];
        deltas[0] = sortedValues[0];
        for (int i = 1; i < sortedValues.length; i++) {
            deltas[i] = sortedValues[i] - sortedValues[i - 1];
        }
        return deltas;
    }

    /**
     * 从Delta编码还原原始序列
     *
     * @param deltas Delta编码后的数组
     * @return 还原后的原始序列
     */
    public static int[] decode(int[] deltas) {
        if (deltas == null) {
            throw new IllegalArgumentException("输入数组不能为null");
        }
        int[] values = new int[deltas.length];
        for (int i = 0; i < deltas.length; i++) {
            values[i] = i == 0 ? deltas[0] : values[i - 1] + deltas[i];
        }
        return values;
    }
}
