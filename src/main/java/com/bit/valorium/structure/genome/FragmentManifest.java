package com.bit.valorium.structure.genome;

import lombok.Value;

/**
 * 片段组清单：再生时校验用的原文长度与校验和
 */
@Value
public class FragmentManifest {

    String baseId;

    int length;

    String checksum;

    int redundancy;
}
