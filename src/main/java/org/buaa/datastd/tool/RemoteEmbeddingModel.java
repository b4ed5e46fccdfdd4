package org.buaa.datastd.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.exception.ServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 OpenAI 兼容 /embeddings 接口的向量模型
 */
@Component
public class RemoteEmbeddingModel implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(RemoteEmbeddingModel.class);

    @Value("${embedding.api.model}")
    private String encodingModel;

    @Value("${embedding.api.batch-size:64}")
    private int processingBatchSize;

    @Value("${embedding.api.dimension:384}")
    private int vectorDimension;

    private final WebClient httpClient;
    private final ObjectMapper jsonParser;

    public RemoteEmbeddingModel(WebClient embeddingWebClient, ObjectMapper objectMapper) {
        this.httpClient = embeddingWebClient;
        this.jsonParser = objectMapper;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        try {
            log.debug("启动向量编码，文本总数: {}", texts.size());

            List<float[]> allVectors = new ArrayList<>(texts.size());
            for (List<String> batch : partitionIntoBatches(texts)) {
                String apiResponse = invokeEncodingApi(batch);
                allVectors.addAll(extractVectorsFromResponse(apiResponse));
            }
            return allVectors;
        } catch (ServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("向量编码失败: {}", e.getMessage(), e);
            throw new ServiceException("向量编码过程出错", e, DataStdErrorCode.EMBEDDING_API_ERROR);
        }
    }

    private List<List<String>> partitionIntoBatches(List<String> texts) {
        List<List<String>> batches = new ArrayList<>();
        for (int i = 0; i < texts.size(); i += processingBatchSize) {
            int endIndex = Math.min(i + processingBatchSize, texts.size());
            batches.add(texts.subList(i, endIndex));
        }
        return batches;
    }

    private String invokeEncodingApi(List<String> batch) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", encodingModel);
        requestBody.put("input", batch);
        requestBody.put("dimension", vectorDimension);
        requestBody.put("encoding_format", "float");

        return httpClient.post()
            .uri("/embeddings")
            .bodyValue(requestBody)
            .retrieve()
            .bodyToMono(String.class)
            .retryWhen(Retry.fixedDelay(3, Duration.ofSeconds(1))
                .filter(error -> error instanceof WebClientResponseException))
            .block(Duration.ofSeconds(30));
    }

    /**
     * 按 index 字段回填，保证与输入顺序一致
     */
    private List<float[]> extractVectorsFromResponse(String response) throws Exception {
        JsonNode dataArray = jsonParser.readTree(response).get("data");
        if (dataArray == null || !dataArray.isArray()) {
            throw new ServiceException("API响应格式异常: 缺少data数组", DataStdErrorCode.EMBEDDING_API_ERROR);
        }

        float[][] ordered = new float[dataArray.size()][];
        int position = 0;
        for (JsonNode item : dataArray) {
            JsonNode embeddingNode = item.get("embedding");
            if (embeddingNode == null || !embeddingNode.isArray()) {
                throw new ServiceException("API响应格式异常: 缺少embedding", DataStdErrorCode.EMBEDDING_API_ERROR);
            }
            int index = item.has("index") ? item.get("index").asInt() : position;
            if (index < 0 || index >= ordered.length) {
                throw new ServiceException("API响应格式异常: index越界 " + index, DataStdErrorCode.EMBEDDING_API_ERROR);
            }
            ordered[index] = parseVector(embeddingNode);
            position++;
        }
        for (int i = 0; i < ordered.length; i++) {
            if (ordered[i] == null) {
                throw new ServiceException("API响应格式异常: 缺少第 " + i + " 条向量", DataStdErrorCode.EMBEDDING_API_ERROR);
            }
        }
        return List.of(ordered);
    }

    private float[] parseVector(JsonNode embeddingNode) {
        float[] vector = new float[embeddingNode.size()];
        for (int i = 0; i < embeddingNode.size(); i++) {
            vector[i] = (float) embeddingNode.get(i).asDouble();
        }
        return vector;
    }
}
