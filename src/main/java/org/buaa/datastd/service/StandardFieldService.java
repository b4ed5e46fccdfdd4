package org.buaa.datastd.service;

import org.buaa.datastd.dao.entity.StandardFieldDO;
import org.buaa.datastd.dao.entity.WordRootDO;
import org.buaa.datastd.dto.req.PageQueryReqDTO;
import org.buaa.datastd.dto.req.StandardFieldSaveReqDTO;
import org.buaa.datastd.dto.resp.ClearResultRespDTO;
import org.buaa.datastd.dto.resp.FieldSearchRespDTO;
import org.buaa.datastd.dto.resp.PageRespDTO;
import org.buaa.datastd.dto.resp.ResyncRespDTO;

import java.util.List;

/**
 * 标准字段服务
 */
public interface StandardFieldService {

    StandardFieldDO create(StandardFieldSaveReqDTO requestParam);

    PageRespDTO<StandardFieldDO> page(PageQueryReqDTO requestParam);

    /**
     * 字段详情：按组成顺序返回构成该字段的词根
     */
    List<WordRootDO> details(Long id);

    StandardFieldDO update(Long id, StandardFieldSaveReqDTO requestParam);

    void delete(Long id);

    ClearResultRespDTO clear();

    ResyncRespDTO resyncVectors();

    /**
     * 混合检索：先字面匹配，无结果时再做语义检索
     *
     * @param query 查询文本
     * @return 检索结果，两种路径返回结构一致
     */
    List<FieldSearchRespDTO> search(String query);
}
