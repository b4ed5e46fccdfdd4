package org.buaa.datastd.service.impl;

import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.exception.AbstractException;
import org.buaa.datastd.common.convention.exception.ClientException;
import org.buaa.datastd.common.toolkit.TermTextUtils;
import org.buaa.datastd.config.DataStandardProperties;
import org.buaa.datastd.dao.entity.WordRootDO;
import org.buaa.datastd.dao.mapper.WordRootMapper;
import org.buaa.datastd.dto.VectorHit;
import org.buaa.datastd.dto.VectorPoint;
import org.buaa.datastd.dto.req.PageQueryReqDTO;
import org.buaa.datastd.dto.req.WordRootSaveReqDTO;
import org.buaa.datastd.dto.resp.ClearResultRespDTO;
import org.buaa.datastd.dto.resp.ImportResultRespDTO;
import org.buaa.datastd.dto.resp.PageRespDTO;
import org.buaa.datastd.dto.resp.RootSuggestionRespDTO;
import org.buaa.datastd.service.VectorIndexService;
import org.buaa.datastd.service.WordRootService;
import org.buaa.datastd.tool.EmbeddingGateway;
import org.buaa.datastd.tool.TokenizerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.buaa.datastd.common.consts.VocabularyConstants.PAYLOAD_CN_NAME;
import static org.buaa.datastd.common.consts.VocabularyConstants.PAYLOAD_EN_ABBR;

/**
 * 词根服务实现
 * 写路径：关系库 → 向量模型 → 向量库 → 分词词典
 */
@Service
public class WordRootServiceImpl extends AbstractVocabularySynchronizer<WordRootDO> implements WordRootService {

    private static final Logger log = LoggerFactory.getLogger(WordRootServiceImpl.class);

    private final WordRootMapper wordRootMapper;
    private final TokenizerState tokenizerState;
    private final DataStandardProperties properties;

    public WordRootServiceImpl(WordRootMapper wordRootMapper,
                               TokenizerState tokenizerState,
                               EmbeddingGateway embeddingGateway,
                               VectorIndexService vectorIndexService,
                               DataStandardProperties properties) {
        super(embeddingGateway, vectorIndexService);
        this.wordRootMapper = wordRootMapper;
        this.tokenizerState = tokenizerState;
        this.properties = properties;
    }

    @Override
    public WordRootDO create(WordRootSaveReqDTO requestParam) {
        WordRootDO root = toEntity(requestParam);
        log.info(">>> 开始创建词根: cnName={}, enAbbr={}", root.getCnName(), root.getEnAbbr());

        writeRow(() -> wordRootMapper.insert(root), root.getCnName(), DataStdErrorCode.WORD_ROOT_NAME_EXISTS);
        WordRootDO saved = reload(root);

        syncVector(saved);
        tokenizerState.learn(saved.getCnName());

        log.info("<<< 词根创建成功: ID={}", saved.getId());
        return saved;
    }

    @Override
    public ImportResultRespDTO batchCreate(List<WordRootSaveReqDTO> items) {
        if (items == null || items.isEmpty()) {
            throw new ClientException(DataStdErrorCode.BATCH_EMPTY);
        }
        log.info(">>> 开始批量导入词根: 总数={}", items.size());

        List<WordRootDO> roots = items.stream().map(this::toEntity).collect(Collectors.toList());
        List<String> texts = roots.stream().map(this::embeddingText).collect(Collectors.toList());
        List<float[]> vectors = embedAllQuietly(texts);

        int successCount = 0;
        List<String> errors = new ArrayList<>();
        List<VectorPoint> points = new ArrayList<>();

        for (int i = 0; i < roots.size(); i++) {
            WordRootDO root = roots.get(i);
            String rowLabel = "行 " + (i + 1) + ": 词根 [" + Optional.ofNullable(root.getCnName()).orElse("") + "] 失败: ";
            if (isBlank(root.getCnName()) || isBlank(root.getEnAbbr())) {
                errors.add(rowLabel + "中文名或英文缩写为空");
                continue;
            }
            try {
                writeRow(() -> wordRootMapper.insert(root), root.getCnName(), DataStdErrorCode.WORD_ROOT_NAME_EXISTS);
            } catch (AbstractException e) {
                errors.add(rowLabel + e.getErrorMessage());
                continue;
            }
            successCount++;
            tokenizerState.learn(root.getCnName());
            if (vectors != null) {
                points.add(new VectorPoint(root.getId(), vectors.get(i), payloadOf(root)));
            }
        }

        upsertQuietly(points);

        log.info("<<< 批量导入完成. 成功: {}, 失败: {}", successCount, errors.size());
        return new ImportResultRespDTO(successCount, errors.size(), errors);
    }

    @Override
    public PageRespDTO<WordRootDO> page(PageQueryReqDTO requestParam) {
        DataStandardProperties.Page config = properties.getPage();
        int pageSize = requestParam.resolvePageSize(config.getDefaultSize(), config.getMaxSize());
        long offset = (long) (requestParam.resolvePage() - 1) * pageSize;
        String keyword = TermTextUtils.escapeLike(requestParam.resolveKeyword());

        long total = wordRootMapper.countByPattern(keyword);
        List<WordRootDO> items = total == 0
            ? Collections.emptyList()
            : wordRootMapper.selectPageByPattern(keyword, offset, pageSize);
        return new PageRespDTO<>(items, total);
    }

    @Override
    public WordRootDO update(Long id, WordRootSaveReqDTO requestParam) {
        WordRootDO root = toEntity(requestParam);
        root.setId(id);
        log.info(">>> 更新词根 ID: {}", id);

        int affected = writeRow(() -> wordRootMapper.updateById(root), root.getCnName(),
            DataStdErrorCode.WORD_ROOT_NAME_EXISTS);
        if (affected == 0) {
            throw new ClientException(DataStdErrorCode.WORD_ROOT_NOT_FOUND);
        }
        WordRootDO saved = reload(root);

        syncVector(saved);
        tokenizerState.learn(saved.getCnName());
        return saved;
    }

    @Override
    public void delete(Long id) {
        log.info(">>> 删除词根: ID={}", id);
        if (!deleteEntity(id)) {
            throw new ClientException(DataStdErrorCode.WORD_ROOT_NOT_FOUND);
        }
    }

    @Override
    public ClearResultRespDTO clear() {
        return clearAll();
    }

    @Override
    public List<RootSuggestionRespDTO> searchSimilar(String query) {
        if (isBlank(query)) {
            return Collections.emptyList();
        }
        log.info(">>> 正在检索语义相近词根: q='{}'", query);
        try {
            float[] vector = embeddingGateway.embed(query.trim());
            List<VectorHit> hits = vectorIndexService.search(collection(), vector,
                properties.getSearch().getSemanticTopK());
            List<RootSuggestionRespDTO> suggestions = hits.stream()
                .map(hit -> RootSuggestionRespDTO.builder()
                    .id(hit.getId())
                    .cnName(hit.payloadText(PAYLOAD_CN_NAME))
                    .enAbbr(hit.payloadText(PAYLOAD_EN_ABBR))
                    .score(hit.getScore())
                    .build())
                .collect(Collectors.toList());
            log.info("<<< 语义搜索完成: 召回数量={}", suggestions.size());
            return suggestions;
        } catch (RuntimeException e) {
            log.error("语义检索词根失败，返回空结果: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    @Override
    public int warmUpTokenizer() {
        log.info("正在加载分词库自定义词典...");
        return tokenizerState.learnAll(wordRootMapper.selectAllNames());
    }

    @Override
    protected String collection() {
        return properties.getVector().getWordRootIndex();
    }

    @Override
    protected String entityLabel() {
        return "词根";
    }

    @Override
    protected Long idOf(WordRootDO entity) {
        return entity.getId();
    }

    @Override
    protected String embeddingText(WordRootDO entity) {
        return TermTextUtils.joinForEmbedding(entity.getCnName(), entity.getEnFullName(), entity.getAssociatedTerms());
    }

    @Override
    protected Map<String, Object> payloadOf(WordRootDO entity) {
        Map<String, Object> payload = new HashMap<>();
        payload.put(PAYLOAD_CN_NAME, entity.getCnName());
        payload.put(PAYLOAD_EN_ABBR, entity.getEnAbbr());
        return payload;
    }

    @Override
    protected List<WordRootDO> loadAllRows() {
        return wordRootMapper.selectAllRoots();
    }

    @Override
    protected int deleteRow(Long id) {
        return wordRootMapper.deleteById(id);
    }

    @Override
    protected void truncateRows() {
        wordRootMapper.truncate();
    }

    private WordRootDO toEntity(WordRootSaveReqDTO requestParam) {
        return WordRootDO.builder()
            .cnName(trimToNull(requestParam.getCnName()))
            .enAbbr(trimToNull(requestParam.getEnAbbr()))
            .enFullName(trimToNull(requestParam.getEnFullName()))
            .associatedTerms(TermTextUtils.normalizeTerms(requestParam.getAssociatedTerms()))
            .remark(requestParam.getRemark())
            .build();
    }

    /**
     * 重新读取以获得数据库生成的字段
     */
    private WordRootDO reload(WordRootDO written) {
        WordRootDO stored = wordRootMapper.selectById(written.getId());
        return stored != null ? stored : written;
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
