package org.buaa.datastd.dto.resp;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 语义相近词根
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RootSuggestionRespDTO {

    private Long id;

    private String cnName;

    private String enAbbr;

    private Double score;
}
