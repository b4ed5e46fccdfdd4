package org.buaa.datastd.dto.req;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 批量导入词根请求参数
 * 单行校验在导入时逐行进行，不因某一行失败拒绝整批
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WordRootBatchReqDTO {

    private List<WordRootSaveReqDTO> items;
}
