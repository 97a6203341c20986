package com.lore.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;

@Data
public class RetrievalRequest {

    @NotBlank(message = "query 不能为空")
    private String query;
}
