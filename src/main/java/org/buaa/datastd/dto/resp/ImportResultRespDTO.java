package org.buaa.datastd.dto.resp;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 批量导入结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportResultRespDTO {

    private int successCount;

    private int failureCount;

    /**
     * 逐行错误信息
     */
    private List<String> errors;
}
