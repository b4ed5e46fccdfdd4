package org.buaa.datastd.common.consts;

/**
 * 词汇表常量
 */
public class VocabularyConstants {

    /**
     * 向量载荷: 中文名
     */
    public static final String PAYLOAD_CN_NAME = "cn_name";

    /**
     * 向量载荷: 英文缩写（词根）
     */
    public static final String PAYLOAD_EN_ABBR = "en_abbr";

    /**
     * 向量载荷: 英文名（标准字段）
     */
    public static final String PAYLOAD_EN_NAME = "en_name";

    /**
     * 向量字段名
     */
    public static final String VECTOR_FIELD = "vector";

    /**
     * 启动时向量模型探测文本
     */
    public static final String EMBEDDING_CHECK_TEXT = "数据标准";
}
