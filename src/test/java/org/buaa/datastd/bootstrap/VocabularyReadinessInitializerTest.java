package org.buaa.datastd.bootstrap;

import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.exception.ServiceException;
import org.buaa.datastd.service.WordRootService;
import org.buaa.datastd.tool.EmbeddingGateway;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VocabularyReadinessInitializerTest {

    @Mock
    private WordRootService wordRootService;

    @Mock
    private EmbeddingGateway embeddingGateway;

    @InjectMocks
    private VocabularyReadinessInitializer initializer;

    @Test
    void warmsTokenizerThenChecksModel() {
        when(wordRootService.warmUpTokenizer()).thenReturn(3);
        when(embeddingGateway.embed(anyString())).thenReturn(new float[384]);

        initializer.afterSingletonsInstantiated();

        InOrder order = inOrder(wordRootService, embeddingGateway);
        order.verify(wordRootService).warmUpTokenizer();
        order.verify(embeddingGateway).embed(anyString());
    }

    @Test
    void tokenizerFailureAbortsStartup() {
        when(wordRootService.warmUpTokenizer()).thenThrow(new QueryTimeoutException("db down"));

        assertThatThrownBy(() -> initializer.afterSingletonsInstantiated())
            .isInstanceOf(ServiceException.class)
            .extracting("errorCode").isEqualTo(DataStdErrorCode.TOKENIZER_ERROR.code());
        verifyNoInteractions(embeddingGateway);
    }

    @Test
    void modelFailureAbortsStartup() {
        when(wordRootService.warmUpTokenizer()).thenReturn(0);
        when(embeddingGateway.embed(anyString()))
            .thenThrow(new ServiceException("向量模型调用失败", DataStdErrorCode.EMBEDDING_SERVICE_ERROR));

        assertThatThrownBy(() -> initializer.afterSingletonsInstantiated())
            .isInstanceOf(ServiceException.class)
            .extracting("errorCode").isEqualTo(DataStdErrorCode.EMBEDDING_SERVICE_ERROR.code());
    }
}
