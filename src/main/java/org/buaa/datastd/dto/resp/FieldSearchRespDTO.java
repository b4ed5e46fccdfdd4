package org.buaa.datastd.dto.resp;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 标准字段检索结果
 * 字面检索与语义检索共用同一结构，字面命中时 score 为空
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldSearchRespDTO {

    private Long id;

    private String fieldCnName;

    private String fieldEnName;

    /**
     * 语义相似度
     */
    private Double score;
}
