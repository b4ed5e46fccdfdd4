package org.buaa.datastd.controller;

import java.util.List;

import org.buaa.datastd.common.convention.result.Result;
import org.buaa.datastd.common.convention.result.Results;
import org.buaa.datastd.dao.entity.WordRootDO;
import org.buaa.datastd.dto.req.PageQueryReqDTO;
import org.buaa.datastd.dto.req.WordRootBatchReqDTO;
import org.buaa.datastd.dto.req.WordRootSaveReqDTO;
import org.buaa.datastd.dto.resp.ClearResultRespDTO;
import org.buaa.datastd.dto.resp.ImportResultRespDTO;
import org.buaa.datastd.dto.resp.PageRespDTO;
import org.buaa.datastd.dto.resp.ResyncRespDTO;
import org.buaa.datastd.service.WordRootService;
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
 * 词根管理控制层
 */
@RestController
@RequestMapping("/api/admin/roots")
@RequiredArgsConstructor
public class WordRootController {

    private final WordRootService wordRootService;

    /**
     * 新建词根
     */
    @PostMapping("")
    public Result<WordRootDO> create(@Validated @RequestBody WordRootSaveReqDTO requestParam) {
        return Results.success(wordRootService.create(requestParam));
    }

    /**
     * 分页查询词根
     */
    @GetMapping("")
    public Result<PageRespDTO<WordRootDO>> page(PageQueryReqDTO requestParam) {
        return Results.success(wordRootService.page(requestParam));
    }

    /**
     * 批量导入词根，逐行返回失败原因
     */
    @PostMapping("/batch")
    public Result<ImportResultRespDTO> batchCreate(@RequestBody WordRootBatchReqDTO requestParam) {
        List<WordRootSaveReqDTO> items = requestParam.getItems();
        return Results.success(wordRootService.batchCreate(items));
    }

    @PutMapping("/{id}")
    public Result<WordRootDO> update(@PathVariable("id") Long id,
                                     @Validated @RequestBody WordRootSaveReqDTO requestParam) {
        return Results.success(wordRootService.update(id, requestParam));
    }

    @DeleteMapping("/{id}")
    public Result<Void> delete(@PathVariable("id") Long id) {
        wordRootService.delete(id);
        return Results.success();
    }

    /**
     * 清空全部词根
     */
    @DeleteMapping("/clear")
    public Result<ClearResultRespDTO> clear() {
        return Results.success(wordRootService.clear());
    }

    /**
     * 以数据库为准重建词根向量
     */
    @PostMapping("/resync")
    public Result<ResyncRespDTO> resync() {
        return Results.success(wordRootService.resyncVectors());
    }
}
