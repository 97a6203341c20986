package com.lore.controller;

import com.lore.common.Result;
import com.lore.dto.EntityTextRequest;
import com.lore.dto.NormalizedTextResponse;
import com.lore.service.ner.CandidateSpan;
import com.lore.service.ner.EntityNormalizationService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.List;

/**
 * 实体抽取与文本规范化
 */
@RestController
@RequestMapping("/api/entities")
public class EntityController {

    private final EntityNormalizationService normalizationService;

    public EntityController(EntityNormalizationService normalizationService) {
        this.normalizationService = normalizationService;
    }

    @PostMapping("/extract")
    public Result<List<CandidateSpan>> extract(@Valid @RequestBody EntityTextRequest request) {
        return Result.success(normalizationService.extract(request.getText(), cutoffOf(request)));
    }

    @PostMapping("/normalize")
    public Result<NormalizedTextResponse> normalize(@Valid @RequestBody EntityTextRequest request) {
        String normalized = normalizationService.normalize(request.getText(), cutoffOf(request));
        return Result.success(new NormalizedTextResponse(request.getText(), normalized));
    }

    private double cutoffOf(EntityTextRequest request) {
        return request.getCutoff() != null ? request.getCutoff() : normalizationService.getDefaultCutoff();
    }
}
