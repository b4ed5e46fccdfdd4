package org.buaa.datastd.tool;

import java.util.List;

/**
 * 向量模型
 * 实现不保证线程安全，调用方需经由 {@link EmbeddingGateway} 串行访问
 */
public interface EmbeddingModel {

    /**
     * 对文本列表进行向量编码
     *
     * @param texts 待编码的文本列表
     * @return 与输入顺序一致的向量列表
     */
    List<float[]> embed(List<String> texts);
}
