package org.buaa.datastd.controller;

import java.util.List;

import org.buaa.datastd.common.convention.result.Result;
import org.buaa.datastd.common.convention.result.Results;
import org.buaa.datastd.dto.resp.FieldSearchRespDTO;
import org.buaa.datastd.dto.resp.RootSuggestionRespDTO;
import org.buaa.datastd.service.StandardFieldService;
import org.buaa.datastd.service.WordRootService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;

/**
 * 公开检索接口
 */
@RestController
@RequestMapping("/api/public")
@RequiredArgsConstructor
public class SearchController {

    private final StandardFieldService standardFieldService;
    private final WordRootService wordRootService;

    /**
     * 标准字段混合检索
     */
    @GetMapping("/search")
    public Result<List<FieldSearchRespDTO>> search(@RequestParam("q") String q) {
        return Results.success(standardFieldService.search(q));
    }

    /**
     * 语义相近词根
     */
    @GetMapping("/similar-roots")
    public Result<List<RootSuggestionRespDTO>> similarRoots(@RequestParam("q") String q) {
        return Results.success(wordRootService.searchSimilar(q));
    }
}
