package org.buaa.datastd.dto.req;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 分页查询参数
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageQueryReqDTO {

    /**
     * 页码，从1开始
     */
    private Integer page;

    private Integer pageSize;

    /**
     * 模糊搜索关键字
     */
    private String q;

    public int resolvePage() {
        return page == null || page < 1 ? 1 : page;
    }

    public int resolvePageSize(int defaultSize, int maxSize) {
        if (pageSize == null || pageSize < 1) {
            return defaultSize;
        }
        return Math.min(pageSize, maxSize);
    }

    /**
     * 去空后的关键字，空白视为不过滤
     */
    public String resolveKeyword() {
        return q == null || q.isBlank() ? null : q.trim();
    }
}
