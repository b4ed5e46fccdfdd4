package org.buaa.datastd.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.buaa.datastd.dao.entity.WordRootDO;

import java.util.List;

/**
 * 分词解析结果
 * 一个词元及其匹配到的候选词根，候选为空表示该词元没有对应词根
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Segment {

    /** 原始切分的词 */
    private String word;

    /** 匹配到的候选词根，精确匹配在前 */
    private List<WordRootDO> candidates;

    public boolean isResolved() {
        return candidates != null && !candidates.isEmpty();
    }
}
