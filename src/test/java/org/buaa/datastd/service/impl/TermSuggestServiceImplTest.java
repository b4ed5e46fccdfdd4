package org.buaa.datastd.service.impl;

import org.buaa.datastd.dao.entity.WordRootDO;
import org.buaa.datastd.dao.mapper.WordRootMapper;
import org.buaa.datastd.dto.Segment;
import org.buaa.datastd.tool.TokenizerState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TermSuggestServiceImplTest {

    @Mock
    private WordRootMapper wordRootMapper;

    @Mock
    private TokenizerState tokenizerState;

    @InjectMocks
    private TermSuggestServiceImpl termSuggestService;

    @Test
    void blankInputYieldsNothing() {
        assertThat(termSuggestService.suggest("")).isEmpty();
        assertThat(termSuggestService.suggest("   ")).isEmpty();
        verifyNoInteractions(wordRootMapper, tokenizerState);
    }

    @Test
    void wholePhraseMatchSkipsSegmentation() {
        when(wordRootMapper.selectLexicalCandidates("客户编号", "客户编号")).thenReturn(List.of(root(1L, "客户编号")));

        List<Segment> segments = termSuggestService.suggest("  客户编号 ");

        assertThat(segments).singleElement().satisfies(segment -> {
            assertThat(segment.getWord()).isEqualTo("客户编号");
            assertThat(segment.getCandidates()).extracting(WordRootDO::getId).containsExactly(1L);
        });
        verify(tokenizerState, never()).segment(anyString());
    }

    @Test
    void segmentsInTokenOrderAndKeepsUnresolvedTokens() {
        when(wordRootMapper.selectLexicalCandidates("客户编号", "客户编号")).thenReturn(List.of());
        when(tokenizerState.segment("客户编号")).thenReturn(List.of("客户", "编号"));
        when(wordRootMapper.selectLexicalCandidates("客户", "客户")).thenReturn(List.of(root(1L, "客户")));
        when(wordRootMapper.selectLexicalCandidates("编号", "编号")).thenReturn(List.of());

        List<Segment> segments = termSuggestService.suggest("客户编号");

        assertThat(segments).extracting(Segment::getWord).containsExactly("客户", "编号");
        assertThat(segments.get(0).isResolved()).isTrue();
        assertThat(segments.get(1).isResolved()).isFalse();
        assertThat(segments.get(1).getCandidates()).isEmpty();
    }

    @Test
    void exactNameRanksBeforeSynonymMatch() {
        when(wordRootMapper.selectLexicalCandidates("客户", "客户")).thenReturn(List.of(
            synonymRoot(2L, "顾客", "客户 买家"),
            synonymRoot(3L, "主顾", "客户"),
            root(1L, "客户")));

        List<Segment> segments = termSuggestService.suggest("客户");

        assertThat(segments).singleElement().satisfies(segment ->
            assertThat(segment.getCandidates()).extracting(WordRootDO::getId).containsExactly(1L, 3L, 2L));
    }

    @Test
    void storeFailureLeavesTokenUnresolved() {
        when(wordRootMapper.selectLexicalCandidates("客户编号", "客户编号")).thenThrow(new QueryTimeoutException("timeout"));
        when(tokenizerState.segment("客户编号")).thenReturn(List.of("客户编号"));

        List<Segment> segments = termSuggestService.suggest("客户编号");

        assertThat(segments).singleElement().satisfies(segment -> assertThat(segment.isResolved()).isFalse());
    }

    @Test
    void wildcardCharactersAreMatchedLiterally() {
        when(wordRootMapper.selectLexicalCandidates("_", "!_")).thenReturn(List.of());
        when(tokenizerState.segment("_")).thenReturn(List.of("_"));

        List<Segment> segments = termSuggestService.suggest("_");

        assertThat(segments).singleElement().satisfies(segment -> assertThat(segment.isResolved()).isFalse());
        verify(tokenizerState).segment("_");
    }

    private static WordRootDO root(Long id, String cnName) {
        return WordRootDO.builder().id(id).cnName(cnName).enAbbr("X").build();
    }

    private static WordRootDO synonymRoot(Long id, String cnName, String terms) {
        return WordRootDO.builder().id(id).cnName(cnName).enAbbr("X").associatedTerms(terms).build();
    }
}
