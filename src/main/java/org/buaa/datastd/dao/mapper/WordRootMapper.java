package org.buaa.datastd.dao.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;
import org.buaa.datastd.dao.entity.WordRootDO;

import java.util.List;

public interface WordRootMapper extends BaseMapper<WordRootDO> {

    /**
     * 字面匹配候选词根：中文名完全相等，或同义词中包含该词元
     *
     * @param token 原始词元，用于等值匹配
     * @param escapedToken 转义通配符后的词元，用于同义词匹配
     */
    @Select("SELECT * FROM standard_word_root WHERE cn_name = #{token} "
        + "OR CONCAT(' ', associated_terms, ' ') LIKE CONCAT('% ', #{escapedToken}, ' %') ESCAPE '!'")
    List<WordRootDO> selectLexicalCandidates(@Param("token") String token,
                                             @Param("escapedToken") String escapedToken);

    /**
     * 分页查询，按中文名或英文缩写模糊匹配（不区分大小写），pattern 需已转义通配符
     */
    @Select("<script>SELECT * FROM standard_word_root"
        + "<if test='pattern != null and pattern != \"\"'>"
        + " WHERE LOWER(cn_name) LIKE CONCAT('%', LOWER(#{pattern}), '%') ESCAPE '!'"
        + " OR LOWER(en_abbr) LIKE CONCAT('%', LOWER(#{pattern}), '%') ESCAPE '!'"
        + "</if>"
        + " ORDER BY created_at DESC, id DESC LIMIT #{limit} OFFSET #{offset}</script>")
    List<WordRootDO> selectPageByPattern(@Param("pattern") String pattern,
                                         @Param("offset") long offset,
                                         @Param("limit") int limit);

    @Select("<script>SELECT COUNT(*) FROM standard_word_root"
        + "<if test='pattern != null and pattern != \"\"'>"
        + " WHERE LOWER(cn_name) LIKE CONCAT('%', LOWER(#{pattern}), '%') ESCAPE '!'"
        + " OR LOWER(en_abbr) LIKE CONCAT('%', LOWER(#{pattern}), '%') ESCAPE '!'"
        + "</if></script>")
    long countByPattern(@Param("pattern") String pattern);

    /**
     * 全部词根中文名，用于分词词典预热
     */
    @Select("SELECT cn_name FROM standard_word_root")
    List<String> selectAllNames();

    /**
     * 全量读取，用于向量全量同步
     */
    @Select("SELECT * FROM standard_word_root ORDER BY id")
    List<WordRootDO> selectAllRoots();

    @Update("TRUNCATE TABLE standard_word_root")
    void truncate();
}
