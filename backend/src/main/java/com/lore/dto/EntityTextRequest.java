package com.lore.dto;

import lombok.Data;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotNull;

/**
 * 实体抽取 / 规范化请求
 */
@Data
public class EntityTextRequest {

    @NotNull(message = "text 不能为空")
    private String text;

    /**
     * 相似度阈值（0-100），为空时使用默认值
     */
    @DecimalMin(value = "0", message = "cutoff 不能小于 0")
    @DecimalMax(value = "100", message = "cutoff 不能大于 100")
    private Double cutoff;
}
