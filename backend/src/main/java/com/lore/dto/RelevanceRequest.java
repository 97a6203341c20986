package com.lore.dto;

import lombok.Data;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import java.util.List;

@Data
public class RelevanceRequest {

    @NotEmpty(message = "titles 不能为空")
    private List<String> titles;

    @Min(value = 1, message = "maxHops 至少为 1")
    private Integer maxHops;
}
