package org.buaa.datastd.controller;

import java.util.List;

import org.buaa.datastd.common.convention.result.Result;
import org.buaa.datastd.common.convention.result.Results;
import org.buaa.datastd.dao.entity.StandardFieldDO;
import org.buaa.datastd.dao.entity.WordRootDO;
import org.buaa.datastd.dto.req.PageQueryReqDTO;
import org.buaa.datastd.dto.req.StandardFieldSaveReqDTO;
import org.buaa.datastd.dto.resp.ClearResultRespDTO;
import org.buaa.datastd.dto.resp.PageRespDTO;
import org.buaa.datastd.dto.resp.ResyncRespDTO;
import org.buaa.datastd.service.StandardFieldService;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;

/**
 * 标准字段管理控制层
 */
@RestController
@RequestMapping("/api/admin/fields")
@RequiredArgsConstructor
public class StandardFieldController {

    private final StandardFieldService standardFieldService;

    @PostMapping("")
    public Result<StandardFieldDO> create(@Validated @RequestBody StandardFieldSaveReqDTO requestParam) {
        return Results.success(standardFieldService.create(requestParam));
    }

    @GetMapping("")
    public Result<PageRespDTO<StandardFieldDO>> page(PageQueryReqDTO requestParam) {
        return Results.success(standardFieldService.page(requestParam));
    }

    /**
     * 字段详情，返回按组成顺序排列的词根
     */
    @GetMapping("/{id}")
    public Result<List<WordRootDO>> details(@PathVariable("id") Long id) {
        return Results.success(standardFieldService.details(id));
    }

    @PutMapping("/{id}")
    public Result<StandardFieldDO> update(@PathVariable("id") Long id,
                                          @Validated @RequestBody StandardFieldSaveReqDTO requestParam) {
        return Results.success(standardFieldService.update(id, requestParam));
    }

    @DeleteMapping("/{id}")
    public Result<Void> delete(@PathVariable("id") Long id) {
        standardFieldService.delete(id);
        return Results.success();
    }

    @DeleteMapping("/clear")
    public Result<ClearResultRespDTO> clear() {
        return Results.success(standardFieldService.clear());
    }

    @PostMapping("/resync")
    public Result<ResyncRespDTO> resync() {
        return Results.success(standardFieldService.resyncVectors());
    }
}
