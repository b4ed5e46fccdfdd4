package org.buaa.datastd.service.impl;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.exception.ServiceException;
import org.buaa.datastd.config.DataStandardProperties;
import org.buaa.datastd.dto.VectorHit;
import org.buaa.datastd.dto.VectorPoint;
import org.buaa.datastd.service.VectorIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import static org.buaa.datastd.common.consts.VocabularyConstants.VECTOR_FIELD;

/**
 * 基于 Elasticsearch dense_vector 的向量库实现
 * 每个集合对应一个索引，文档ID即词汇实体主键
 */
@Service
public class ElasticsearchVectorIndexServiceImpl implements VectorIndexService {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchVectorIndexServiceImpl.class);
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ElasticsearchClient esClient;
    private final ObjectMapper objectMapper;
    private final int dimension;
    private final int numCandidates;

    public ElasticsearchVectorIndexServiceImpl(ElasticsearchClient esClient,
                                               ObjectMapper objectMapper,
                                               DataStandardProperties properties) {
        this.esClient = esClient;
        this.objectMapper = objectMapper;
        this.dimension = properties.getVector().getDimension();
        this.numCandidates = properties.getSearch().getNumCandidates();
    }

    @Override
    public void ensureCollection(String collection) {
        try {
            boolean exists = esClient.indices().exists(builder -> builder.index(collection)).value();
            if (exists) {
                return;
            }
            log.info("正在创建向量集合: {}", collection);
            esClient.indices().create(builder -> builder
                .index(collection)
                .mappings(mapping -> mapping
                    .properties(VECTOR_FIELD, property -> property
                        .denseVector(vector -> vector
                            .dims(dimension)
                            .index(true)
                            .similarity("cosine")
                        )
                    )
                )
            );
        } catch (Exception e) {
            throw new ServiceException("无法创建向量集合: " + collection, e, DataStdErrorCode.VECTOR_INDEX_ERROR);
        }
    }

    @Override
    public void upsert(String collection, List<VectorPoint> points) {
        if (points == null || points.isEmpty()) {
            return;
        }
        List<BulkOperation> operations = points.stream()
            .map(point -> BulkOperation.of(op -> op.index(idx -> idx
                .index(collection)
                .id(String.valueOf(point.getId()))
                .document(toDocument(point))
            )))
            .collect(Collectors.toList());
        executeBulk(collection, operations, "写入");
        log.debug("向量写入完成: 集合={}, 数量={}", collection, points.size());
    }

    @Override
    public void deleteByIds(String collection, List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        List<BulkOperation> operations = ids.stream()
            .map(id -> BulkOperation.of(op -> op.delete(del -> del
                .index(collection)
                .id(String.valueOf(id))
            )))
            .collect(Collectors.toList());
        executeBulk(collection, operations, "删除");
    }

    @Override
    public void deleteAll(String collection) {
        try {
            DeleteByQueryResponse response = esClient.deleteByQuery(builder -> builder
                .index(collection)
                .query(query -> query.matchAll(all -> all))
                .refresh(true)
            );
            log.info("向量集合已清空: {}, 删除数: {}", collection, response.deleted());
        } catch (Exception e) {
            if (isIndexMissing(e)) {
                log.warn("向量集合 {} 不存在，无需清空", collection);
                return;
            }
            throw new ServiceException("向量集合清空失败: " + collection, e, DataStdErrorCode.VECTOR_INDEX_ERROR);
        }
    }

    @Override
    public void deleteAllExcept(String collection, Collection<Long> keepIds) {
        if (keepIds == null || keepIds.isEmpty()) {
            deleteAll(collection);
            return;
        }
        List<String> keep = keepIds.stream().map(String::valueOf).collect(Collectors.toList());
        try {
            DeleteByQueryResponse response = esClient.deleteByQuery(builder -> builder
                .index(collection)
                .query(query -> query.bool(bool -> bool
                    .mustNot(mustNot -> mustNot.ids(ids -> ids.values(keep)))
                ))
                .refresh(true)
            );
            log.info("已清理失效向量: 集合={}, 删除数={}", collection, response.deleted());
        } catch (Exception e) {
            if (isIndexMissing(e)) {
                log.warn("向量集合 {} 不存在，无需清理", collection);
                return;
            }
            throw new ServiceException("失效向量清理失败: " + collection, e, DataStdErrorCode.VECTOR_INDEX_ERROR);
        }
    }

    @Override
    public List<VectorHit> search(String collection, float[] vector, int k) {
        List<Float> queryVector = new ArrayList<>(vector.length);
        for (float value : vector) {
            queryVector.add(value);
        }

        try {
            SearchResponse<ObjectNode> response = esClient.search(searchBuilder -> searchBuilder
                .index(collection)
                .knn(knnBuilder -> knnBuilder
                    .field(VECTOR_FIELD)
                    .queryVector(queryVector)
                    .k(k)
                    .numCandidates(Math.max(numCandidates, k))
                )
                .source(source -> source.filter(filter -> filter.excludes(VECTOR_FIELD)))
                .size(k),
                ObjectNode.class
            );

            return response.hits().hits().stream()
                .map(hit -> new VectorHit(
                    Long.valueOf(hit.id()),
                    hit.score(),
                    hit.source() == null ? Map.of() : objectMapper.convertValue(hit.source(), PAYLOAD_TYPE)
                ))
                .collect(Collectors.toList());
        } catch (Exception e) {
            if (isIndexMissing(e)) {
                log.warn("向量集合 {} 不存在，返回空结果", collection);
                return Collections.emptyList();
            }
            throw new ServiceException("向量检索失败: " + collection, e, DataStdErrorCode.VECTOR_INDEX_ERROR);
        }
    }

    private Map<String, Object> toDocument(VectorPoint point) {
        Map<String, Object> document = new HashMap<>();
        if (point.getPayload() != null) {
            document.putAll(point.getPayload());
        }
        document.put(VECTOR_FIELD, point.getVector());
        return document;
    }

    private void executeBulk(String collection, List<BulkOperation> operations, String action) {
        BulkResponse response;
        try {
            response = esClient.bulk(builder -> builder
                .operations(operations)
                .refresh(Refresh.True)
            );
        } catch (Exception e) {
            throw new ServiceException("向量" + action + "失败: " + collection, e, DataStdErrorCode.VECTOR_INDEX_ERROR);
        }
        if (response.errors()) {
            for (BulkResponseItem item : response.items()) {
                if (item.error() != null) {
                    log.error("向量{}失败 - 集合: {}, ID: {}, 原因: {}",
                        action, collection, item.id(), item.error().reason());
                }
            }
            throw new ServiceException("部分向量" + action + "失败: " + collection, DataStdErrorCode.VECTOR_INDEX_ERROR);
        }
    }

    private boolean isIndexMissing(Throwable error) {
        if (error == null) {
            return false;
        }
        String message = error.getMessage();
        if (message != null && message.toLowerCase(Locale.ROOT).contains("index_not_found")) {
            return true;
        }
        return isIndexMissing(error.getCause());
    }
}
