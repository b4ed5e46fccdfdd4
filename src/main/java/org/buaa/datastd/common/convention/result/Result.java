package org.buaa.datastd.common.convention.result;

import lombok.Data;
import lombok.experimental.Accessors;
import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;

import java.io.Serial;
import java.io.Serializable;

/**
 * 统一返回对象
 *
 * @param <T> 响应数据类型
 */
@Data
@Accessors(chain = true)
public class Result<T> implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * 成功状态码
     */
    public static final String SUCCESS_CODE = DataStdErrorCode.SUCCESS.code();

    /**
     * 返回码
     * "0" 表示成功，其他值表示错误（格式：A0xxx/B0xxx/C0xxx）
     */
    private String code;

    private String message;

    private T data;

    public boolean isSuccess() {
        return SUCCESS_CODE.equals(code);
    }
}
