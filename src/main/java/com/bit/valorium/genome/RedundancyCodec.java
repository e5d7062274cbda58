package com.bit.valorium.genome;

import com.bit.valorium.config.ValoriumProperties;
import com.bit.valorium.util.ByteUtils;
import com.bit.valorium.util.Sha;
import org.springframework.stereotype.Component;

/**
 * XOR 冗余编解码
 * <p>
 * 第 i 个冗余片段 = 原文 XOR mask(baseId, i)，掩码由 HMAC-SHA256(maskKey, baseId || i || counter) 逐块拼接而成。
 * 掩码只依赖片段ID和密钥，任意一个存活的冗余片段都能单独还原原文。
 */
@Component
public class RedundancyCodec {

    private static final int BLOCK_SIZE = 32;

    private final byte[] maskKey;

    public RedundancyCodec(ValoriumProperties properties) {
        this.maskKey = ByteUtils.utf8(properties.getGenome().getMaskKey());
    }

    public byte[] mask(String baseId, int index, int length) {
        byte[] mask = new byte[length];
        byte[] prefix = ByteUtils.concat(ByteUtils.utf8(baseId), ByteUtils.longToBytes(index));
        for (int offset = 0, counter = 0; offset < length; offset += BLOCK_SIZE, counter++) {
            byte[] block = Sha.applyHmacSHA256(maskKey, ByteUtils.concat(prefix, ByteUtils.longToBytes(counter)));
            System.arraycopy(block, 0, mask, offset, Math.min(BLOCK_SIZE, length - offset));
        }
        return mask;
    }

    public byte[] encode(byte[] original, String baseId, int index) {
        return ByteUtils.xor(original, mask(baseId, index, original.length));
    }

    public byte[] decode(byte[] redundant, String baseId, int index) {
        return ByteUtils.xor(redundant, mask(baseId, index, redundant.length));
    }
}
