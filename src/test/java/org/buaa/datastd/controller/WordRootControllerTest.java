package org.buaa.datastd.controller;

import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.exception.ClientException;
import org.buaa.datastd.common.web.GlobalExceptionHandler;
import org.buaa.datastd.dao.entity.WordRootDO;
import org.buaa.datastd.dto.req.WordRootSaveReqDTO;
import org.buaa.datastd.dto.resp.ImportResultRespDTO;
import org.buaa.datastd.service.WordRootService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WordRootControllerTest {

    @Mock
    private WordRootService wordRootService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new WordRootController(wordRootService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void createReturnsSavedRoot() throws Exception {
        when(wordRootService.create(any(WordRootSaveReqDTO.class)))
            .thenReturn(WordRootDO.builder().id(1L).cnName("客户").enAbbr("CUST").build());

        mockMvc.perform(post("/api/admin/roots")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cnName\":\"客户\",\"enAbbr\":\"CUST\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value("0"))
            .andExpect(jsonPath("$.data.id").value(1))
            .andExpect(jsonPath("$.data.cnName").value("客户"));
    }

    @Test
    void createWithBlankNameIsRejectedBeforeService() throws Exception {
        mockMvc.perform(post("/api/admin/roots")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cnName\":\" \",\"enAbbr\":\"CUST\"}"))
            .andExpect(jsonPath("$.code").value(DataStdErrorCode.PARAM_INVALID.code()))
            .andExpect(jsonPath("$.message").value("词根中文名不能为空"));

        verifyNoInteractions(wordRootService);
    }

    @Test
    void batchReportsPerRowErrors() throws Exception {
        when(wordRootService.batchCreate(anyList()))
            .thenReturn(new ImportResultRespDTO(1, 1, List.of("行 2: 词根 [客户] 失败: 词根 [客户] 已存在")));

        mockMvc.perform(post("/api/admin/roots/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"items\":[{\"cnName\":\"账户\",\"enAbbr\":\"ACCT\"},{\"cnName\":\"客户\",\"enAbbr\":\"CUST\"}]}"))
            .andExpect(jsonPath("$.data.successCount").value(1))
            .andExpect(jsonPath("$.data.failureCount").value(1))
            .andExpect(jsonPath("$.data.errors[0]").value("行 2: 词根 [客户] 失败: 词根 [客户] 已存在"));
    }

    @Test
    void deleteOfMissingRootReportsNotFound() throws Exception {
        doThrow(new ClientException(DataStdErrorCode.WORD_ROOT_NOT_FOUND)).when(wordRootService).delete(8L);

        mockMvc.perform(delete("/api/admin/roots/8"))
            .andExpect(jsonPath("$.code").value(DataStdErrorCode.WORD_ROOT_NOT_FOUND.code()));
    }
}
