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

import java.time.LocalDateTime;

/**
 * 标准词根实体
 * 主键同时作为向量库中的点ID
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("standard_word_root")
public class WordRootDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * 中文名，唯一
     */
    private String cnName;

    /**
     * 英文缩写
     */
    private String enAbbr;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String enFullName;

    /**
     * 同义词，空格分隔
     */
    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String associatedTerms;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String remark;

    private LocalDateTime createdAt;
}
