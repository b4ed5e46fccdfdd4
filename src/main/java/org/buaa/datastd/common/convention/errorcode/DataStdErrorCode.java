package org.buaa.datastd.common.convention.errorcode;

/**
 * 数据标准业务错误码枚举
 *
 * 错误码规范：
 * - 0: 成功
 * - A0xxx: 客户端错误（参数校验、资源不存在等）
 * - B0xxx: 服务端错误（业务逻辑、数据库等）
 * - C0xxx: 外部依赖错误（向量库、向量模型）
 */
public enum DataStdErrorCode implements IErrorCode {

    // ==================== 通用错误 ====================
    SUCCESS("0", "操作成功"),

    CLIENT_ERROR("A0001", "客户端请求错误"),

    SERVICE_ERROR("B0001", "服务端执行错误"),

    // ==================== 参数校验错误 (A01xx) ====================
    PARAM_EMPTY("A0101", "必填参数为空"),

    PARAM_INVALID("A0102", "参数格式错误"),

    /**
     * 查询内容不能为空
     */
    QUERY_EMPTY("A0103", "查询内容不能为空"),

    /**
     * 批量导入内容为空
     */
    BATCH_EMPTY("A0104", "批量导入内容不能为空"),

    // ==================== 词根相关错误 (A02xx) ====================
    WORD_ROOT_NOT_FOUND("A0201", "词根不存在"),

    WORD_ROOT_NAME_EXISTS("A0202", "词根中文名已存在"),

    // ==================== 标准字段相关错误 (A03xx) ====================
    STANDARD_FIELD_NOT_FOUND("A0301", "标准字段不存在"),

    STANDARD_FIELD_NAME_EXISTS("A0302", "标准字段中文名已存在"),

    /**
     * 组成词根引用了不存在的词根
     */
    COMPOSITION_ROOT_MISSING("A0303", "组成词根不存在"),

    // ==================== 服务端错误 (B01xx) ====================
    DATABASE_ERROR("B0101", "数据库操作异常"),

    EMBEDDING_SERVICE_ERROR("B0102", "向量化服务异常"),

    TOKENIZER_ERROR("B0103", "分词服务异常"),

    // ==================== 外部依赖错误 (C01xx) ====================
    VECTOR_INDEX_ERROR("C0101", "向量库服务异常"),

    EMBEDDING_API_ERROR("C0102", "向量化API异常");

    private final String code;
    private final String message;

    DataStdErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String code() {
        return this.code;
    }

    @Override
    public String message() {
        return this.message;
    }
}
