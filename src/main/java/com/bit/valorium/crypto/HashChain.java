package com.bit.valorium.crypto;

import com.bit.valorium.common.Hash256;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

/**
 * 内容寻址原语：对任意结构化记录做确定性哈希
 * <p>
 * 规范编码：JSON，属性和 Map 键按字母序排序，无空白，UTF-8；然后交给注入的哈希原语（SHA-256）。
 * 相同逻辑内容总是得到相同摘要。无副作用，不缓存。
 */
@Component
public class HashChain {

    private final CryptoPrimitive cryptoPrimitive;

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public HashChain(CryptoPrimitive cryptoPrimitive) {
        this.cryptoPrimitive = cryptoPrimitive;
    }

    public Hash256 digest(Object record) {
        return cryptoPrimitive.hash(canonicalBytes(record));
    }

    public Hash256 digestBytes(byte[] data) {
        return cryptoPrimitive.hash(data);
    }

    /**
     * 记录的规范字节编码
     */
    public byte[] canonicalBytes(Object record) {
        try {
            return canonicalMapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("记录无法规范化编码: " + record.getClass().getSimpleName(), e);
        }
    }
}
