package com.lore.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class NormalizedTextResponse {

    private String original;

    private String normalized;
}
