package com.bit.valorium.structure.dto;

import lombok.Data;

/**
 * trustedHash 为空时按官方发布规则由版本号派生
 */
@Data
public class RegisterVersionRequest {
    private String version;
    private String trustedHash;
}
