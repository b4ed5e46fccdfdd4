package org.buaa.datastd.service;

import org.buaa.datastd.dao.entity.WordRootDO;
import org.buaa.datastd.dto.req.PageQueryReqDTO;
import org.buaa.datastd.dto.req.WordRootSaveReqDTO;
import org.buaa.datastd.dto.resp.ClearResultRespDTO;
import org.buaa.datastd.dto.resp.ImportResultRespDTO;
import org.buaa.datastd.dto.resp.PageRespDTO;
import org.buaa.datastd.dto.resp.ResyncRespDTO;
import org.buaa.datastd.dto.resp.RootSuggestionRespDTO;

import java.util.List;

/**
 * 词根服务
 */
public interface WordRootService {

    /**
     * 新建词根，同步向量库与分词词典
     */
    WordRootDO create(WordRootSaveReqDTO requestParam);

    /**
     * 批量导入词根，单行失败不影响其他行
     */
    ImportResultRespDTO batchCreate(List<WordRootSaveReqDTO> items);

    /**
     * 分页查询，支持按中文名或英文缩写模糊搜索
     */
    PageRespDTO<WordRootDO> page(PageQueryReqDTO requestParam);

    /**
     * 更新词根，主键保持不变
     */
    WordRootDO update(Long id, WordRootSaveReqDTO requestParam);

    /**
     * 删除词根，记录不存在时抛出客户端异常
     */
    void delete(Long id);

    /**
     * 清空全部词根
     */
    ClearResultRespDTO clear();

    /**
     * 以关系库为准重建词根向量集合
     */
    ResyncRespDTO resyncVectors();

    /**
     * 语义相近词根检索，后端不可用时返回空列表
     */
    List<RootSuggestionRespDTO> searchSimilar(String query);

    /**
     * 用全部词根中文名预热分词词典
     *
     * @return 写入的词条数
     */
    int warmUpTokenizer();
}
