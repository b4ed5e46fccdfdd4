package org.buaa.datastd.service;

import org.buaa.datastd.dto.Segment;

import java.util.List;

/**
 * 分词建议服务
 * 将中文短语解析为标准词根
 */
public interface TermSuggestService {

    /**
     * 先整词匹配，整词无结果时再分词逐个匹配
     *
     * @param text 中文输入
     * @return 按分词顺序排列的解析结果，空白输入返回空列表
     */
    List<Segment> suggest(String text);
}
