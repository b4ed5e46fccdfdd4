package org.buaa.datastd.tool;

import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.exception.ServiceException;
import org.buaa.datastd.config.DataStandardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 向量模型网关
 *
 * <p>所有向量化调用（单条或批量）都经过同一把互斥锁串行执行。锁只覆盖模型推理本身，
 * 调用方拿到向量后再访问向量库或关系库，不会持锁做网络 I/O。</p>
 */
@Component
public class EmbeddingGateway {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingGateway.class);

    private final EmbeddingModel model;
    private final int dimension;
    private final ReentrantLock inferenceLock = new ReentrantLock();

    public EmbeddingGateway(EmbeddingModel model, DataStandardProperties properties) {
        this.model = model;
        this.dimension = properties.getVector().getDimension();
    }

    /**
     * 批量向量化
     *
     * @param texts 待编码文本
     * @return 与输入等长、同序的向量列表
     * @throws ServiceException 模型调用失败或输出与输入不对应
     */
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        List<float[]> vectors;
        inferenceLock.lock();
        try {
            vectors = model.embed(texts);
        } catch (ServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ServiceException("向量模型调用失败", e, DataStdErrorCode.EMBEDDING_SERVICE_ERROR);
        } finally {
            inferenceLock.unlock();
        }

        validate(texts, vectors);
        return vectors;
    }

    /**
     * 单条向量化
     */
    public float[] embed(String text) {
        return embed(List.of(text)).get(0);
    }

    private void validate(List<String> texts, List<float[]> vectors) {
        if (vectors == null || vectors.size() != texts.size()) {
            int actual = vectors == null ? 0 : vectors.size();
            log.error("向量数量与输入不一致: 输入={}, 输出={}", texts.size(), actual);
            throw new ServiceException("向量数量与输入不一致", DataStdErrorCode.EMBEDDING_SERVICE_ERROR);
        }
        for (float[] vector : vectors) {
            if (vector == null || vector.length != dimension) {
                throw new ServiceException("向量维度异常，期望 " + dimension,
                    DataStdErrorCode.EMBEDDING_SERVICE_ERROR);
            }
        }
    }
}
