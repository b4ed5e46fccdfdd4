package org.buaa.datastd.bootstrap;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.exception.ServiceException;
import org.buaa.datastd.service.WordRootService;
import org.buaa.datastd.tool.EmbeddingGateway;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

import static org.buaa.datastd.common.consts.VocabularyConstants.EMBEDDING_CHECK_TEXT;

/**
 * 对外服务前的阻塞预热：加载分词词典并探测向量模型
 * 在单例初始化完成后、Web 服务器开始监听前执行，任一步失败都会中止启动
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VocabularyReadinessInitializer implements SmartInitializingSingleton {

    private final WordRootService wordRootService;
    private final EmbeddingGateway embeddingGateway;

    @Override
    public void afterSingletonsInstantiated() {
        int learned;
        try {
            learned = wordRootService.warmUpTokenizer();
        } catch (RuntimeException e) {
            throw new ServiceException("分词词典预热失败", e, DataStdErrorCode.TOKENIZER_ERROR);
        }

        float[] sample = embeddingGateway.embed(EMBEDDING_CHECK_TEXT);
        log.info("启动预热完成: 词典词条={}, 向量维度={}", learned, sample.length);
    }
}
