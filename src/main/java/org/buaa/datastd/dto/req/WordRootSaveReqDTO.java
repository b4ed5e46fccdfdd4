package org.buaa.datastd.dto.req;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 新建/更新词根请求参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WordRootSaveReqDTO {

    /**
     * 中文名
     */
    @NotBlank(message = "词根中文名不能为空")
    private String cnName;

    /**
     * 英文缩写
     */
    @NotBlank(message = "英文缩写不能为空")
    private String enAbbr;

    /**
     * 英文全称
     */
    private String enFullName;

    /**
     * 同义词，支持中英文逗号或空格分隔
     */
    private String associatedTerms;

    /**
     * 备注
     */
    private String remark;
}
