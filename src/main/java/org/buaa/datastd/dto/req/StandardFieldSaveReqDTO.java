package org.buaa.datastd.dto.req;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 新建/更新标准字段请求参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StandardFieldSaveReqDTO {

    @NotBlank(message = "字段中文名不能为空")
    private String fieldCnName;

    @NotBlank(message = "字段英文名不能为空")
    private String fieldEnName;

    /**
     * 组成词根ID，顺序即英文名拼装顺序
     */
    private List<Long> compositionIds;

    private String dataType;

    private String associatedTerms;
}
