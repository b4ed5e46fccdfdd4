package org.buaa.datastd.controller;

import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.exception.ClientException;
import org.buaa.datastd.common.convention.result.Result;
import org.buaa.datastd.common.convention.result.Results;
import org.buaa.datastd.dto.resp.SuggestRespDTO;
import org.buaa.datastd.service.TermSuggestService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;

/**
 * 分词建议控制层
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class TermSuggestController {

    private final TermSuggestService termSuggestService;

    /**
     * 将中文短语解析为候选词根
     */
    @GetMapping("/suggest")
    public Result<SuggestRespDTO> suggest(@RequestParam(value = "q", required = false) String q) {
        if (q == null || q.isBlank()) {
            throw new ClientException(DataStdErrorCode.QUERY_EMPTY);
        }
        return Results.success(new SuggestRespDTO(termSuggestService.suggest(q)));
    }
}
