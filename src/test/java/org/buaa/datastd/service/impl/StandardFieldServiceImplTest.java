package org.buaa.datastd.service.impl;

import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.exception.ClientException;
import org.buaa.datastd.common.convention.exception.ServiceException;
import org.buaa.datastd.config.DataStandardProperties;
import org.buaa.datastd.dao.entity.StandardFieldDO;
import org.buaa.datastd.dao.entity.WordRootDO;
import org.buaa.datastd.dao.mapper.StandardFieldMapper;
import org.buaa.datastd.dao.mapper.WordRootMapper;
import org.buaa.datastd.dto.VectorHit;
import org.buaa.datastd.dto.VectorPoint;
import org.buaa.datastd.dto.req.PageQueryReqDTO;
import org.buaa.datastd.dto.req.StandardFieldSaveReqDTO;
import org.buaa.datastd.dto.resp.FieldSearchRespDTO;
import org.buaa.datastd.dto.resp.PageRespDTO;
import org.buaa.datastd.service.VectorIndexService;
import org.buaa.datastd.tool.EmbeddingGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StandardFieldServiceImplTest {

    private static final String COLLECTION = "standard_fields";

    @Mock
    private StandardFieldMapper standardFieldMapper;

    @Mock
    private WordRootMapper wordRootMapper;

    @Mock
    private EmbeddingGateway embeddingGateway;

    @Mock
    private VectorIndexService vectorIndexService;

    private StandardFieldServiceImpl standardFieldService;

    @BeforeEach
    void setUp() {
        standardFieldService = new StandardFieldServiceImpl(standardFieldMapper, wordRootMapper,
            embeddingGateway, vectorIndexService, new DataStandardProperties());
    }

    @Test
    void lexicalHitsAreReturnedWithoutSemanticSearch() {
        when(standardFieldMapper.selectLexicalMatches("客户", 10)).thenReturn(List.of(
            field(1L, "客户编号", "cust_no"),
            field(2L, "客户名称", "cust_name")));

        List<FieldSearchRespDTO> result = standardFieldService.search("客户");

        assertThat(result).extracting(FieldSearchRespDTO::getId).containsExactly(1L, 2L);
        assertThat(result).extracting(FieldSearchRespDTO::getScore).containsOnlyNulls();
        verifyNoInteractions(embeddingGateway, vectorIndexService);
    }

    @Test
    void fallsBackToSemanticSearch() {
        float[] vector = new float[384];
        when(standardFieldMapper.selectLexicalMatches("顾客号", 10)).thenReturn(List.of());
        when(embeddingGateway.embed("顾客号")).thenReturn(vector);
        when(vectorIndexService.search(COLLECTION, vector, 5)).thenReturn(List.of(
            new VectorHit(1L, 0.88, Map.of("cn_name", "客户编号", "en_name", "cust_no"))));

        List<FieldSearchRespDTO> result = standardFieldService.search("顾客号");

        assertThat(result).singleElement().satisfies(hit -> {
            assertThat(hit.getId()).isEqualTo(1L);
            assertThat(hit.getFieldCnName()).isEqualTo("客户编号");
            assertThat(hit.getFieldEnName()).isEqualTo("cust_no");
            assertThat(hit.getScore()).isEqualTo(0.88);
        });
    }

    @Test
    void semanticFailureDegradesToEmpty() {
        when(standardFieldMapper.selectLexicalMatches("顾客号", 10)).thenReturn(List.of());
        when(embeddingGateway.embed(anyString()))
            .thenThrow(new ServiceException("向量模型调用失败", DataStdErrorCode.EMBEDDING_SERVICE_ERROR));

        assertThat(standardFieldService.search("顾客号")).isEmpty();
    }

    @Test
    void lexicalStoreFailureStillTriesSemantic() {
        float[] vector = new float[384];
        when(standardFieldMapper.selectLexicalMatches("顾客号", 10)).thenThrow(new QueryTimeoutException("timeout"));
        when(embeddingGateway.embed("顾客号")).thenReturn(vector);
        when(vectorIndexService.search(COLLECTION, vector, 5)).thenReturn(List.of());

        assertThat(standardFieldService.search("顾客号")).isEmpty();
        verify(vectorIndexService).search(COLLECTION, vector, 5);
    }

    @Test
    void wildcardQueryIsEscapedBeforeLexicalMatch() {
        float[] vector = new float[384];
        when(standardFieldMapper.selectLexicalMatches("100!%", 10)).thenReturn(List.of());
        when(embeddingGateway.embed("100%")).thenReturn(vector);
        when(vectorIndexService.search(COLLECTION, vector, 5)).thenReturn(List.of());

        assertThat(standardFieldService.search("100%")).isEmpty();
        verify(embeddingGateway).embed("100%");
    }

    @Test
    void pageKeywordIsEscaped() {
        when(standardFieldMapper.countByPattern("客户!_编号")).thenReturn(0L);

        PageRespDTO<StandardFieldDO> page = standardFieldService.page(new PageQueryReqDTO(1, 20, " 客户_编号 "));

        assertThat(page.getTotal()).isZero();
        assertThat(page.getItems()).isEmpty();
        verify(standardFieldMapper, never()).selectPageByPattern(anyString(), anyLong(), anyInt());
    }

    @Test
    void blankQueryReturnsEmpty() {
        assertThat(standardFieldService.search(" ")).isEmpty();
        verifyNoInteractions(standardFieldMapper, embeddingGateway, vectorIndexService);
    }

    @Test
    void detailsFollowCompositionOrder() {
        StandardFieldDO stored = field(9L, "客户账户编号", "cust_acct_no");
        stored.setCompositionIds(List.of(3L, 1L, 2L));
        when(standardFieldMapper.selectById(9L)).thenReturn(stored);
        when(wordRootMapper.selectBatchIds(anyCollection())).thenReturn(List.of(
            root(1L, "账户"), root(2L, "编号"), root(3L, "客户")));

        List<WordRootDO> roots = standardFieldService.details(9L);

        assertThat(roots).extracting(WordRootDO::getCnName).containsExactly("客户", "账户", "编号");
    }

    @Test
    void detailsOfMissingFieldIsNotFound() {
        assertThatThrownBy(() -> standardFieldService.details(404L))
            .isInstanceOf(ClientException.class)
            .extracting("errorCode").isEqualTo(DataStdErrorCode.STANDARD_FIELD_NOT_FOUND.code());
    }

    @Test
    void createRejectsMissingCompositionRoot() {
        when(wordRootMapper.selectBatchIds(anyCollection())).thenReturn(List.of(root(1L, "客户")));

        assertThatThrownBy(() -> standardFieldService.create(request(List.of(1L, 2L))))
            .isInstanceOf(ClientException.class)
            .extracting("errorCode").isEqualTo(DataStdErrorCode.COMPOSITION_ROOT_MISSING.code());
        verify(standardFieldMapper, never()).insert(any(StandardFieldDO.class));
        verifyNoInteractions(embeddingGateway, vectorIndexService);
    }

    @Test
    void createKeepsCompositionOrderAndSyncsVector() {
        when(wordRootMapper.selectBatchIds(anyCollection())).thenReturn(List.of(root(1L, "客户"), root(2L, "编号")));
        when(standardFieldMapper.insert(any(StandardFieldDO.class))).thenAnswer(invocation -> {
            invocation.<StandardFieldDO>getArgument(0).setId(11L);
            return 1;
        });
        when(embeddingGateway.embed("客户编号 cust_no 顾客号")).thenReturn(new float[384]);

        StandardFieldDO saved = standardFieldService.create(request(List.of(2L, 1L)));

        assertThat(saved.getCompositionIds()).containsExactly(2L, 1L);
        @SuppressWarnings({"unchecked", "rawtypes"})
        ArgumentCaptor<List<VectorPoint>> points = (ArgumentCaptor) ArgumentCaptor.forClass(List.class);
        verify(vectorIndexService).upsert(eq(COLLECTION), points.capture());
        assertThat(points.getValue()).singleElement().satisfies(point -> {
            assertThat(point.getId()).isEqualTo(11L);
            assertThat(point.getPayload()).containsEntry("cn_name", "客户编号").containsEntry("en_name", "cust_no");
        });
    }

    @Test
    void updateOfMissingFieldIsNotFound() {
        when(standardFieldMapper.updateById(any(StandardFieldDO.class))).thenReturn(0);

        assertThatThrownBy(() -> standardFieldService.update(5L, request(List.of())))
            .isInstanceOf(ClientException.class)
            .extracting("errorCode").isEqualTo(DataStdErrorCode.STANDARD_FIELD_NOT_FOUND.code());
    }

    @Test
    void deleteOfMissingFieldNeverTouchesIndex() {
        when(standardFieldMapper.deleteById(5L)).thenReturn(0);

        assertThatThrownBy(() -> standardFieldService.delete(5L)).isInstanceOf(ClientException.class);
        verifyNoInteractions(vectorIndexService);
    }

    private static StandardFieldSaveReqDTO request(List<Long> compositionIds) {
        return StandardFieldSaveReqDTO.builder()
            .fieldCnName("客户编号")
            .fieldEnName("cust_no")
            .compositionIds(compositionIds)
            .dataType("VARCHAR(32)")
            .associatedTerms("顾客号")
            .build();
    }

    private static StandardFieldDO field(Long id, String cnName, String enName) {
        return StandardFieldDO.builder().id(id).fieldCnName(cnName).fieldEnName(enName).build();
    }

    private static WordRootDO root(Long id, String cnName) {
        return WordRootDO.builder().id(id).cnName(cnName).enAbbr(cnName).build();
    }
}
