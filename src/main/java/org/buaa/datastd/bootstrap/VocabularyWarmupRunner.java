package org.buaa.datastd.bootstrap;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.buaa.datastd.config.DataStandardProperties;
import org.buaa.datastd.dto.resp.ResyncRespDTO;
import org.buaa.datastd.service.StandardFieldService;
import org.buaa.datastd.service.VectorIndexService;
import org.buaa.datastd.service.WordRootService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * 启动后的向量库准备：创建向量集合，按配置全量同步向量
 * 均为尽力而为，失败只记录日志
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VocabularyWarmupRunner implements ApplicationRunner {

    private final VectorIndexService vectorIndexService;
    private final WordRootService wordRootService;
    private final StandardFieldService standardFieldService;
    private final DataStandardProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        ensureCollection(properties.getVector().getWordRootIndex());
        ensureCollection(properties.getVector().getStandardFieldIndex());

        if (properties.getSync().isResyncOnStartup()) {
            resync("词根", wordRootService::resyncVectors);
            resync("标准字段", standardFieldService::resyncVectors);
        }
    }

    private void ensureCollection(String collection) {
        try {
            vectorIndexService.ensureCollection(collection);
        } catch (RuntimeException e) {
            log.warn("向量集合初始化失败: 集合={}, 原因={}", collection, e.getMessage());
        }
    }

    private void resync(String label, Supplier<ResyncRespDTO> action) {
        try {
            ResyncRespDTO result = action.get();
            log.info("{} 向量同步完成: 集合={}, 总数={}, 已同步={}",
                label, result.getCollection(), result.getTotal(), result.getSynced());
        } catch (RuntimeException e) {
            log.error("{} 向量同步失败: {}", label, e.getMessage(), e);
        }
    }
}
