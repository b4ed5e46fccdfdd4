package org.buaa.datastd.service.impl;

import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.errorcode.IErrorCode;
import org.buaa.datastd.common.convention.exception.ClientException;
import org.buaa.datastd.common.convention.exception.ServiceException;
import org.buaa.datastd.dto.VectorPoint;
import org.buaa.datastd.dto.resp.ClearResultRespDTO;
import org.buaa.datastd.dto.resp.ResyncRespDTO;
import org.buaa.datastd.service.VectorIndexService;
import org.buaa.datastd.tool.EmbeddingGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 关系库与向量库双写同步
 *
 * <p>关系库是唯一可信来源，先写关系库，成功后再计算向量并写入向量库。
 * 向量侧失败只记录日志，不影响请求结果，由下一次修改或全量同步修复。</p>
 *
 * <p>单条向量写入持读锁，全量同步与清空持写锁，
 * 同步期间提交的向量写入排在同步之后落盘，不会被同步的清理步骤删掉。</p>
 *
 * @param <T> 词汇实体类型
 */
public abstract class AbstractVocabularySynchronizer<T> {

    private final Logger log = LoggerFactory.getLogger(getClass());

    protected final EmbeddingGateway embeddingGateway;
    protected final VectorIndexService vectorIndexService;

    private final ReadWriteLock vectorLock = new ReentrantReadWriteLock();

    protected AbstractVocabularySynchronizer(EmbeddingGateway embeddingGateway,
                                             VectorIndexService vectorIndexService) {
        this.embeddingGateway = embeddingGateway;
        this.vectorIndexService = vectorIndexService;
    }

    /**
     * 向量集合名
     */
    protected abstract String collection();

    /**
     * 实体描述，用于日志与错误信息
     */
    protected abstract String entityLabel();

    protected abstract Long idOf(T entity);

    /**
     * 拼接参与向量化的文本
     */
    protected abstract String embeddingText(T entity);

    /**
     * 向量点载荷，至少包含检索结果展示所需的名称字段
     */
    protected abstract Map<String, Object> payloadOf(T entity);

    protected abstract List<T> loadAllRows();

    protected abstract int deleteRow(Long id);

    protected abstract void truncateRows();

    /**
     * 执行关系库写入并转换异常：唯一键冲突为客户端错误，其余为数据库错误
     */
    protected <R> R writeRow(Supplier<R> action, String name, IErrorCode duplicateCode) {
        try {
            return action.get();
        } catch (DuplicateKeyException e) {
            throw new ClientException(entityLabel() + " [" + name + "] 已存在", e, duplicateCode);
        } catch (DataAccessException e) {
            log.error("{} [{}] 写入失败", entityLabel(), name, e);
            throw new ServiceException(entityLabel() + " [" + name + "] 写入失败", e, DataStdErrorCode.DATABASE_ERROR);
        }
    }

    /**
     * 单条实体向量同步，失败不抛出
     *
     * @return 是否写入成功
     */
    protected boolean syncVector(T entity) {
        Long id = idOf(entity);
        try {
            float[] vector = embeddingGateway.embed(embeddingText(entity));
            withReadLock(() -> vectorIndexService.upsert(collection(),
                List.of(new VectorPoint(id, vector, payloadOf(entity)))));
            log.debug("向量同步完成: 集合={}, ID={}", collection(), id);
            return true;
        } catch (RuntimeException e) {
            log.warn("向量同步失败，等待下次同步修复: 集合={}, ID={}, 原因={}", collection(), id, e.getMessage());
            return false;
        }
    }

    /**
     * 批量向量化，失败返回 null
     */
    protected List<float[]> embedAllQuietly(List<String> texts) {
        try {
            return embeddingGateway.embed(texts);
        } catch (RuntimeException e) {
            log.warn("批量向量化失败，本批仅写入关系库: 集合={}, 数量={}, 原因={}",
                collection(), texts.size(), e.getMessage());
            return null;
        }
    }

    /**
     * 批量写入向量点，失败不抛出
     */
    protected boolean upsertQuietly(List<VectorPoint> points) {
        if (points.isEmpty()) {
            return true;
        }
        try {
            withReadLock(() -> vectorIndexService.upsert(collection(), points));
            return true;
        } catch (RuntimeException e) {
            log.warn("批量向量写入失败: 集合={}, 数量={}, 原因={}", collection(), points.size(), e.getMessage());
            return false;
        }
    }

    /**
     * 先删关系库，确有行被删除时再删向量点
     *
     * @return false 表示记录不存在
     */
    public boolean deleteEntity(Long id) {
        int affected;
        try {
            affected = deleteRow(id);
        } catch (DataAccessException e) {
            log.error("{} 删除失败: ID={}", entityLabel(), id, e);
            throw new ServiceException(entityLabel() + "删除失败", e, DataStdErrorCode.DATABASE_ERROR);
        }
        if (affected == 0) {
            return false;
        }
        try {
            withReadLock(() -> vectorIndexService.deleteByIds(collection(), List.of(id)));
        } catch (RuntimeException e) {
            log.warn("向量删除失败: 集合={}, ID={}, 原因={}", collection(), id, e.getMessage());
        }
        return true;
    }

    /**
     * 清空关系表并尽力清空向量集合
     */
    protected ClearResultRespDTO clearAll() {
        vectorLock.writeLock().lock();
        try {
            return clearAllLocked();
        } finally {
            vectorLock.writeLock().unlock();
        }
    }

    private ClearResultRespDTO clearAllLocked() {
        try {
            truncateRows();
        } catch (DataAccessException e) {
            log.error("{} 清空失败", entityLabel(), e);
            throw new ServiceException(entityLabel() + "清空失败", e, DataStdErrorCode.DATABASE_ERROR);
        }
        try {
            vectorIndexService.deleteAll(collection());
            log.info("{} 数据已全部清空", entityLabel());
            return new ClearResultRespDTO(true, "所有" + entityLabel() + "数据已成功清空");
        } catch (RuntimeException e) {
            log.warn("{} 关系库已清空但向量库清空失败: {}", entityLabel(), e.getMessage());
            return new ClearResultRespDTO(false, "数据库已清空但向量库失败: " + e.getMessage());
        }
    }

    /**
     * 全量同步：读取关系库全部记录，重新向量化后写入，再删除关系库中已不存在的向量点
     * 向量化失败时不动向量库
     */
    public ResyncRespDTO resyncVectors() {
        vectorLock.writeLock().lock();
        try {
            return resyncLocked();
        } finally {
            vectorLock.writeLock().unlock();
        }
    }

    private ResyncRespDTO resyncLocked() {
        log.info("正在同步 [{}] 向量到向量库...", entityLabel());
        List<T> rows = loadAllRows();
        if (rows.isEmpty()) {
            pruneQuietly(Collections.emptyList());
            return new ResyncRespDTO(collection(), 0, 0);
        }

        List<String> texts = rows.stream().map(this::embeddingText).collect(Collectors.toList());
        List<float[]> vectors = embedAllQuietly(texts);
        if (vectors == null) {
            return new ResyncRespDTO(collection(), rows.size(), 0);
        }

        List<VectorPoint> points = new ArrayList<>(rows.size());
        List<Long> ids = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            T row = rows.get(i);
            ids.add(idOf(row));
            points.add(new VectorPoint(idOf(row), vectors.get(i), payloadOf(row)));
        }

        int synced;
        try {
            vectorIndexService.upsert(collection(), points);
            synced = points.size();
        } catch (RuntimeException e) {
            log.warn("全量同步写入失败: 集合={}, 数量={}, 原因={}", collection(), points.size(), e.getMessage());
            return new ResyncRespDTO(collection(), rows.size(), 0);
        }
        pruneQuietly(ids);
        log.info("完成 {} 条 [{}] 向量同步", synced, entityLabel());
        return new ResyncRespDTO(collection(), rows.size(), synced);
    }

    private void pruneQuietly(List<Long> keepIds) {
        try {
            if (keepIds.isEmpty()) {
                vectorIndexService.deleteAll(collection());
            } else {
                vectorIndexService.deleteAllExcept(collection(), keepIds);
            }
        } catch (RuntimeException e) {
            log.warn("清理失效向量失败: 集合={}, 原因={}", collection(), e.getMessage());
        }
    }

    private void withReadLock(Runnable action) {
        vectorLock.readLock().lock();
        try {
            action.run();
        } finally {
            vectorLock.readLock().unlock();
        }
    }
}
