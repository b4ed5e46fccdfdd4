package org.buaa.datastd.dto.resp;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 向量全量同步结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResyncRespDTO {

    private String collection;

    /**
     * 关系库中的记录数
     */
    private int total;

    /**
     * 写入向量库的点数
     */
    private int synced;
}
