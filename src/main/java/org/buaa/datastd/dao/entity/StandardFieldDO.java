package org.buaa.datastd.dao.entity;

import com.baomidou.mybatisplus.annotation.FieldStrategy;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.buaa.datastd.dao.handler.LongListTypeHandler;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 标准字段实体
 * 由有序的词根ID列表组合而成，顺序即英文名的拼装顺序
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName(value = "standard_field", autoResultMap = true)
public class StandardFieldDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String fieldCnName;

    private String fieldEnName;

    /**
     * 组成词根ID，JSON 数组存储
     */
    @TableField(typeHandler = LongListTypeHandler.class, updateStrategy = FieldStrategy.IGNORED)
    private List<Long> compositionIds;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String dataType;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String associatedTerms;

    /**
     * 是否标准字段，由数据库维护
     */
    private Boolean isStandard;

    private LocalDateTime createdAt;
}
