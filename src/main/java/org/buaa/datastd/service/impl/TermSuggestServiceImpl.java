package org.buaa.datastd.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.buaa.datastd.common.toolkit.TermTextUtils;
import org.buaa.datastd.dao.entity.WordRootDO;
import org.buaa.datastd.dao.mapper.WordRootMapper;
import org.buaa.datastd.dto.Segment;
import org.buaa.datastd.service.TermSuggestService;
import org.buaa.datastd.tool.TokenizerState;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 分词建议服务实现
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TermSuggestServiceImpl implements TermSuggestService {

    private final WordRootMapper wordRootMapper;
    private final TokenizerState tokenizerState;

    @Override
    public List<Segment> suggest(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String input = text.trim();

        // 整词命中时不再切分
        List<WordRootDO> wholeMatches = lookup(input);
        if (!wholeMatches.isEmpty()) {
            log.debug("整词命中词根: input='{}', 候选数={}", input, wholeMatches.size());
            return List.of(new Segment(input, rank(input, wholeMatches)));
        }

        List<String> words = tokenizerState.segment(input);
        log.debug("分词结果: input='{}', words={}", input, words);

        List<Segment> segments = new ArrayList<>(words.size());
        for (String word : words) {
            segments.add(new Segment(word, rank(word, lookup(word))));
        }
        return segments;
    }

    private List<WordRootDO> lookup(String token) {
        try {
            return wordRootMapper.selectLexicalCandidates(token, TermTextUtils.escapeLike(token));
        } catch (DataAccessException ex) {
            log.error("词根候选查询失败: token='{}'", token, ex);
            return List.of();
        }
    }

    /**
     * 中文名与词元完全相等的排在前面，其余按中文名排序
     */
    private static List<WordRootDO> rank(String word, List<WordRootDO> candidates) {
        List<WordRootDO> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator
            .comparing((WordRootDO root) -> !word.equals(root.getCnName()))
            .thenComparing(WordRootDO::getCnName, Comparator.nullsLast(Comparator.naturalOrder())));
        return ranked;
    }
}
