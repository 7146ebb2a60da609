package com.example.automation.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 启用/停用请求体，enabled 为空时由接口层取反当前状态。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToggleRequest {

    private Boolean enabled;
}
