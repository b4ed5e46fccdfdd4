package org.buaa.datastd.dto.resp;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.buaa.datastd.dto.Segment;

import java.util.List;

/**
 * 分词建议响应
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SuggestRespDTO {

    private List<Segment> segments;
}
