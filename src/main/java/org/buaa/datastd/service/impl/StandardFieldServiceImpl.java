package org.buaa.datastd.service.impl;

import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.exception.ClientException;
import org.buaa.datastd.common.toolkit.TermTextUtils;
import org.buaa.datastd.config.DataStandardProperties;
import org.buaa.datastd.dao.entity.StandardFieldDO;
import org.buaa.datastd.dao.entity.WordRootDO;
import org.buaa.datastd.dao.mapper.StandardFieldMapper;
import org.buaa.datastd.dao.mapper.WordRootMapper;
import org.buaa.datastd.dto.VectorHit;
import org.buaa.datastd.dto.req.PageQueryReqDTO;
import org.buaa.datastd.dto.req.StandardFieldSaveReqDTO;
import org.buaa.datastd.dto.resp.ClearResultRespDTO;
import org.buaa.datastd.dto.resp.FieldSearchRespDTO;
import org.buaa.datastd.dto.resp.PageRespDTO;
import org.buaa.datastd.service.StandardFieldService;
import org.buaa.datastd.service.VectorIndexService;
import org.buaa.datastd.tool.EmbeddingGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.buaa.datastd.common.consts.VocabularyConstants.PAYLOAD_CN_NAME;
import static org.buaa.datastd.common.consts.VocabularyConstants.PAYLOAD_EN_NAME;

/**
 * 标准字段服务实现
 */
@Service
public class StandardFieldServiceImpl extends AbstractVocabularySynchronizer<StandardFieldDO>
    implements StandardFieldService {

    private static final Logger log = LoggerFactory.getLogger(StandardFieldServiceImpl.class);

    private final StandardFieldMapper standardFieldMapper;
    private final WordRootMapper wordRootMapper;
    private final DataStandardProperties properties;

    public StandardFieldServiceImpl(StandardFieldMapper standardFieldMapper,
                                    WordRootMapper wordRootMapper,
                                    EmbeddingGateway embeddingGateway,
                                    VectorIndexService vectorIndexService,
                                    DataStandardProperties properties) {
        super(embeddingGateway, vectorIndexService);
        this.standardFieldMapper = standardFieldMapper;
        this.wordRootMapper = wordRootMapper;
        this.properties = properties;
    }

    @Override
    public StandardFieldDO create(StandardFieldSaveReqDTO requestParam) {
        StandardFieldDO field = toEntity(requestParam);
        log.info(">>> 开始创建标准字段: cnName={}, enName={}", field.getFieldCnName(), field.getFieldEnName());

        verifyComposition(field.getCompositionIds());
        writeRow(() -> standardFieldMapper.insert(field), field.getFieldCnName(),
            DataStdErrorCode.STANDARD_FIELD_NAME_EXISTS);
        StandardFieldDO saved = reload(field);

        syncVector(saved);
        log.info("<<< 标准字段创建成功: ID={}", saved.getId());
        return saved;
    }

    @Override
    public PageRespDTO<StandardFieldDO> page(PageQueryReqDTO requestParam) {
        DataStandardProperties.Page config = properties.getPage();
        int pageSize = requestParam.resolvePageSize(config.getDefaultSize(), config.getMaxSize());
        long offset = (long) (requestParam.resolvePage() - 1) * pageSize;
        String keyword = TermTextUtils.escapeLike(requestParam.resolveKeyword());

        long total = standardFieldMapper.countByPattern(keyword);
        List<StandardFieldDO> items = total == 0
            ? Collections.emptyList()
            : standardFieldMapper.selectPageByPattern(keyword, offset, pageSize);
        return new PageRespDTO<>(items, total);
    }

    @Override
    public List<WordRootDO> details(Long id) {
        StandardFieldDO field = standardFieldMapper.selectById(id);
        if (field == null) {
            throw new ClientException(DataStdErrorCode.STANDARD_FIELD_NOT_FOUND);
        }
        List<Long> compositionIds = field.getCompositionIds();
        if (compositionIds == null || compositionIds.isEmpty()) {
            return Collections.emptyList();
        }

        Map<Long, WordRootDO> rootsById = loadRoots(compositionIds);
        // 按组成顺序输出，与主键顺序无关
        return compositionIds.stream()
            .map(rootsById::get)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    @Override
    public StandardFieldDO update(Long id, StandardFieldSaveReqDTO requestParam) {
        StandardFieldDO field = toEntity(requestParam);
        field.setId(id);
        log.info(">>> 更新标准字段: ID={}", id);

        verifyComposition(field.getCompositionIds());
        int affected = writeRow(() -> standardFieldMapper.updateById(field), field.getFieldCnName(),
            DataStdErrorCode.STANDARD_FIELD_NAME_EXISTS);
        if (affected == 0) {
            throw new ClientException(DataStdErrorCode.STANDARD_FIELD_NOT_FOUND);
        }
        StandardFieldDO saved = reload(field);

        syncVector(saved);
        return saved;
    }

    @Override
    public void delete(Long id) {
        log.info(">>> 删除标准字段: ID={}", id);
        if (!deleteEntity(id)) {
            throw new ClientException(DataStdErrorCode.STANDARD_FIELD_NOT_FOUND);
        }
    }

    @Override
    public ClearResultRespDTO clear() {
        return clearAll();
    }

    @Override
    public List<FieldSearchRespDTO> search(String query) {
        if (query == null || query.isBlank()) {
            return Collections.emptyList();
        }

        List<StandardFieldDO> lexicalMatches = lexicalSearch(query);
        if (!lexicalMatches.isEmpty()) {
            log.debug("字面检索命中 {} 条: q='{}'", lexicalMatches.size(), query);
            return lexicalMatches.stream()
                .map(field -> FieldSearchRespDTO.builder()
                    .id(field.getId())
                    .fieldCnName(field.getFieldCnName())
                    .fieldEnName(field.getFieldEnName())
                    .build())
                .collect(Collectors.toList());
        }

        return semanticSearch(query);
    }

    private List<StandardFieldDO> lexicalSearch(String query) {
        try {
            return standardFieldMapper.selectLexicalMatches(TermTextUtils.escapeLike(query),
                properties.getSearch().getLexicalLimit());
        } catch (DataAccessException e) {
            log.error("字面检索失败，转入语义检索: q='{}'", query, e);
            return Collections.emptyList();
        }
    }

    private List<FieldSearchRespDTO> semanticSearch(String query) {
        try {
            float[] vector = embeddingGateway.embed(query);
            List<VectorHit> hits = vectorIndexService.search(collection(), vector,
                properties.getSearch().getSemanticTopK());
            return hits.stream()
                .map(hit -> FieldSearchRespDTO.builder()
                    .id(hit.getId())
                    .fieldCnName(hit.payloadText(PAYLOAD_CN_NAME))
                    .fieldEnName(hit.payloadText(PAYLOAD_EN_NAME))
                    .score(hit.getScore())
                    .build())
                .collect(Collectors.toList());
        } catch (RuntimeException e) {
            log.warn("语义检索不可用，返回空结果: q='{}', 原因={}", query, e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * 组成词根必须全部存在
     */
    private void verifyComposition(List<Long> compositionIds) {
        if (compositionIds == null || compositionIds.isEmpty()) {
            return;
        }
        if (compositionIds.contains(null)) {
            throw new ClientException("组成词根ID不能为空", DataStdErrorCode.PARAM_INVALID);
        }
        Map<Long, WordRootDO> existing = loadRoots(compositionIds);
        List<Long> missing = compositionIds.stream()
            .distinct()
            .filter(rootId -> !existing.containsKey(rootId))
            .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new ClientException("组成词根不存在: " + missing, DataStdErrorCode.COMPOSITION_ROOT_MISSING);
        }
    }

    private Map<Long, WordRootDO> loadRoots(List<Long> rootIds) {
        Set<Long> distinctIds = new LinkedHashSet<>(rootIds);
        return wordRootMapper.selectBatchIds(distinctIds).stream()
            .collect(Collectors.toMap(WordRootDO::getId, Function.identity(), (left, right) -> left));
    }

    @Override
    protected String collection() {
        return properties.getVector().getStandardFieldIndex();
    }

    @Override
    protected String entityLabel() {
        return "标准字段";
    }

    @Override
    protected Long idOf(StandardFieldDO entity) {
        return entity.getId();
    }

    @Override
    protected String embeddingText(StandardFieldDO entity) {
        return TermTextUtils.joinForEmbedding(entity.getFieldCnName(), entity.getFieldEnName(),
            entity.getAssociatedTerms());
    }

    @Override
    protected Map<String, Object> payloadOf(StandardFieldDO entity) {
        Map<String, Object> payload = new HashMap<>();
        payload.put(PAYLOAD_CN_NAME, entity.getFieldCnName());
        payload.put(PAYLOAD_EN_NAME, entity.getFieldEnName());
        return payload;
    }

    @Override
    protected List<StandardFieldDO> loadAllRows() {
        return standardFieldMapper.selectAllFields();
    }

    @Override
    protected int deleteRow(Long id) {
        return standardFieldMapper.deleteById(id);
    }

    @Override
    protected void truncateRows() {
        standardFieldMapper.truncate();
    }

    private StandardFieldDO toEntity(StandardFieldSaveReqDTO requestParam) {
        List<Long> compositionIds = requestParam.getCompositionIds() == null
            ? new ArrayList<>()
            : new ArrayList<>(requestParam.getCompositionIds());
        return StandardFieldDO.builder()
            .fieldCnName(requestParam.getFieldCnName() == null ? null : requestParam.getFieldCnName().trim())
            .fieldEnName(requestParam.getFieldEnName() == null ? null : requestParam.getFieldEnName().trim())
            .compositionIds(compositionIds)
            .dataType(requestParam.getDataType())
            .associatedTerms(TermTextUtils.normalizeTerms(requestParam.getAssociatedTerms()))
            .build();
    }

    private StandardFieldDO reload(StandardFieldDO written) {
        StandardFieldDO stored = standardFieldMapper.selectById(written.getId());
        return stored != null ? stored : written;
    }
}
