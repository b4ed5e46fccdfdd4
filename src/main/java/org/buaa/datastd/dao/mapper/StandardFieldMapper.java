package org.buaa.datastd.dao.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.ResultMap;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;
import org.buaa.datastd.dao.entity.StandardFieldDO;

import java.util.List;

public interface StandardFieldMapper extends BaseMapper<StandardFieldDO> {

    String RESULT_MAP = "mybatis-plus_StandardFieldDO";

    /**
     * 分页查询，按中文名或同义词模糊匹配（不区分大小写），pattern 需已转义通配符
     */
    @ResultMap(RESULT_MAP)
    @Select("<script>SELECT * FROM standard_field"
        + "<if test='pattern != null and pattern != \"\"'>"
        + " WHERE LOWER(field_cn_name) LIKE CONCAT('%', LOWER(#{pattern}), '%') ESCAPE '!'"
        + " OR LOWER(associated_terms) LIKE CONCAT('%', LOWER(#{pattern}), '%') ESCAPE '!'"
        + "</if>"
        + " ORDER BY created_at DESC, id DESC LIMIT #{limit} OFFSET #{offset}</script>")
    List<StandardFieldDO> selectPageByPattern(@Param("pattern") String pattern,
                                              @Param("offset") long offset,
                                              @Param("limit") int limit);

    @Select("<script>SELECT COUNT(*) FROM standard_field"
        + "<if test='pattern != null and pattern != \"\"'>"
        + " WHERE LOWER(field_cn_name) LIKE CONCAT('%', LOWER(#{pattern}), '%') ESCAPE '!'"
        + " OR LOWER(associated_terms) LIKE CONCAT('%', LOWER(#{pattern}), '%') ESCAPE '!'"
        + "</if></script>")
    long countByPattern(@Param("pattern") String pattern);

    /**
     * 字面检索，保持存储自然顺序，query 需已转义通配符
     */
    @ResultMap(RESULT_MAP)
    @Select("SELECT * FROM standard_field"
        + " WHERE LOWER(field_cn_name) LIKE CONCAT('%', LOWER(#{query}), '%') ESCAPE '!'"
        + " OR LOWER(associated_terms) LIKE CONCAT('%', LOWER(#{query}), '%') ESCAPE '!'"
        + " LIMIT #{limit}")
    List<StandardFieldDO> selectLexicalMatches(@Param("query") String query, @Param("limit") int limit);

    @ResultMap(RESULT_MAP)
    @Select("SELECT * FROM standard_field ORDER BY id")
    List<StandardFieldDO> selectAllFields();

    @Update("TRUNCATE TABLE standard_field")
    void truncate();
}
