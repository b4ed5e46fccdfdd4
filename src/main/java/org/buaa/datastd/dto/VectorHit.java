package org.buaa.datastd.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 向量近邻检索命中
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VectorHit {

    private Long id;

    private Double score;

    private Map<String, Object> payload;

    public String payloadText(String key) {
        if (payload == null) {
            return null;
        }
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }
}
