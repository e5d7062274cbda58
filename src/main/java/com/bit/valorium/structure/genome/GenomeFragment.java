package com.bit.valorium.structure.genome;

import lombok.Builder;
import lombok.Value;

/**
 * 账本历史数据片段
 * <p>
 * 主片段 index = PRIMARY_INDEX，载荷为原文；冗余片段 index = 0..k-1，载荷为原文与第 index 个掩码的异或。
 * checksum 始终是原文载荷的 SHA-256（十六进制），解码后用它校验。
 */
@Value
@Builder(toBuilder = true)
public class GenomeFragment {

    public static final int PRIMARY_INDEX = -1;

    public static final String REDUNDANCY_SEPARATOR = "_r";

    /**
     * 片段ID：主片段为 baseId，冗余片段为 baseId_r{index}
     */
    String fragmentId;

    String baseId;

    int index;

    byte[] payload;

    String checksum;

    /**
     * 冗余因子 k
     */
    int redundancy;

    public boolean isPrimary() {
        return index == PRIMARY_INDEX;
    }

    public static String idOf(String baseId, int index) {
        return index == PRIMARY_INDEX ? baseId : baseId + REDUNDANCY_SEPARATOR + index;
    }

    /**
     * 由片段ID还原 baseId
     */
    public static String baseIdOf(String fragmentId) {
        int pos = fragmentId.lastIndexOf(REDUNDANCY_SEPARATOR);
        if (pos < 0) {
            return fragmentId;
        }
        String suffix = fragmentId.substring(pos + REDUNDANCY_SEPARATOR.length());
        return !suffix.isEmpty() && suffix.chars().allMatch(Character::isDigit) ? fragmentId.substring(0, pos) : fragmentId;
    }

    public static int indexOf(String fragmentId) {
        String baseId = baseIdOf(fragmentId);
        if (baseId.equals(fragmentId)) {
            return PRIMARY_INDEX;
        }
        return Integer.parseInt(fragmentId.substring(baseId.length() + REDUNDANCY_SEPARATOR.length()));
    }
}
