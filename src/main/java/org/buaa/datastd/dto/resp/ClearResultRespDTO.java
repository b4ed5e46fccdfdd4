package org.buaa.datastd.dto.resp;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 清空结果
 * 关系库清空成功但向量库清空失败时 vectorCleared 为 false
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClearResultRespDTO {

    private boolean vectorCleared;

    private String message;
}
