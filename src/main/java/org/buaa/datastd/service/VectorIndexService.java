package org.buaa.datastd.service;

import org.buaa.datastd.dto.VectorHit;
import org.buaa.datastd.dto.VectorPoint;

import java.util.Collection;
import java.util.List;

/**
 * 向量库访问接口
 * 点ID与关系库主键一一对应，每个集合对应一类词汇实体
 */
public interface VectorIndexService {

    /**
     * 集合不存在时按配置维度与余弦相似度创建
     */
    void ensureCollection(String collection);

    /**
     * 批量写入或覆盖向量点
     */
    void upsert(String collection, List<VectorPoint> points);

    /**
     * 按ID删除向量点
     */
    void deleteByIds(String collection, List<Long> ids);

    /**
     * 删除集合内全部向量点
     */
    void deleteAll(String collection);

    /**
     * 删除集合内ID不在保留集合中的向量点
     */
    void deleteAllExcept(String collection, Collection<Long> keepIds);

    /**
     * 余弦相似度近邻检索
     *
     * @param collection 集合名
     * @param vector 查询向量
     * @param k 返回条数
     * @return 按相似度降序的命中列表
     */
    List<VectorHit> search(String collection, float[] vector, int k);
}
