package com.scout.pipeline.transform.api;

import com.scout.pipeline.transform.model.AggregateRefresh;
import com.scout.pipeline.transform.model.LayerCounts;
import com.scout.pipeline.transform.model.PromotionSummary;
import com.scout.pipeline.transform.model.RefreshSummary;
import com.scout.pipeline.transform.service.StagedTransformService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/transform")
public class TransformController {
    private final StagedTransformService transformService;

    public TransformController(StagedTransformService transformService) {
        this.transformService = transformService;
    }

    @PostMapping("/promote")
    public PromotionSummary promote() {
        return transformService.promote();
    }

    @PostMapping("/refresh")
    public RefreshSummary refresh() {
        return transformService.refreshAggregates();
    }

    @GetMapping("/layers")
    public LayerCounts layers() {
        return transformService.layerCounts();
    }

    @GetMapping("/refresh-log")
    public List<AggregateRefresh> refreshLog(@RequestParam(name = "limit", required = false, defaultValue = "20") int limit) {
        return transformService.recentRefreshes(limit);
    }
}
