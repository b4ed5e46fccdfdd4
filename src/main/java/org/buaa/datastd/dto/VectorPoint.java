package org.buaa.datastd.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

/**
 * 向量库写入点，ID 与关系库主键一致
 */
@Data
@AllArgsConstructor
public class VectorPoint {

    private Long id;

    private float[] vector;

    private Map<String, Object> payload;
}
