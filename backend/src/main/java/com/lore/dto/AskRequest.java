package com.lore.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;

@Data
public class AskRequest {

    @NotBlank(message = "question 不能为空")
    private String question;
}
