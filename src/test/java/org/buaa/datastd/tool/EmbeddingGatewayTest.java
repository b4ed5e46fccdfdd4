package org.buaa.datastd.tool;

import org.buaa.datastd.common.convention.errorcode.DataStdErrorCode;
import org.buaa.datastd.common.convention.exception.ServiceException;
import org.buaa.datastd.config.DataStandardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class EmbeddingGatewayTest {

    private DataStandardProperties properties;

    @BeforeEach
    void setUp() {
        properties = new DataStandardProperties();
        properties.getVector().setDimension(3);
    }

    @Test
    void keepsInputOrder() {
        EmbeddingModel model = texts -> {
            List<float[]> vectors = new ArrayList<>();
            for (String text : texts) {
                vectors.add(new float[]{text.length(), 0f, 0f});
            }
            return vectors;
        };
        EmbeddingGateway gateway = new EmbeddingGateway(model, properties);

        List<float[]> vectors = gateway.embed(List.of("a", "bbb", "cc"));

        assertThat(vectors).extracting(v -> v[0]).containsExactly(1f, 3f, 2f);
    }

    @Test
    void emptyInputSkipsModel() {
        EmbeddingModel model = mock(EmbeddingModel.class);
        EmbeddingGateway gateway = new EmbeddingGateway(model, properties);

        assertThat(gateway.embed(List.of())).isEmpty();
        verifyNoInteractions(model);
    }

    @Test
    void rejectsCountMismatch() {
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.embed(anyList())).thenReturn(List.of(new float[3]));
        EmbeddingGateway gateway = new EmbeddingGateway(model, properties);

        assertThatThrownBy(() -> gateway.embed(List.of("a", "b")))
            .isInstanceOf(ServiceException.class)
            .extracting("errorCode").isEqualTo(DataStdErrorCode.EMBEDDING_SERVICE_ERROR.code());
    }

    @Test
    void rejectsWrongDimension() {
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.embed(anyList())).thenReturn(List.of(new float[5]));
        EmbeddingGateway gateway = new EmbeddingGateway(model, properties);

        assertThatThrownBy(() -> gateway.embed("客户")).isInstanceOf(ServiceException.class);
    }

    @Test
    void wrapsModelFailure() {
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.embed(anyList())).thenThrow(new IllegalStateException("model offline"));
        EmbeddingGateway gateway = new EmbeddingGateway(model, properties);

        assertThatThrownBy(() -> gateway.embed("客户"))
            .isInstanceOf(ServiceException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void serializesConcurrentCalls() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        EmbeddingModel model = texts -> {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            return List.of(new float[3]);
        };
        EmbeddingGateway gateway = new EmbeddingGateway(model, properties);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<float[]>> futures = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            String text = "词" + i;
            futures.add(executor.submit(() -> {
                start.await();
                return gateway.embed(text);
            }));
        }
        start.countDown();
        for (Future<float[]> future : futures) {
            assertThat(future.get(10, TimeUnit.SECONDS)).hasSize(3);
        }
        executor.shutdown();

        assertThat(maxInFlight.get()).isEqualTo(1);
    }
}
