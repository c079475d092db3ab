package com.adaptivelimiter.service;

import com.adaptivelimiter.model.AdaptiveDecision;
import com.adaptivelimiter.model.SystemLoad;
import com.adaptivelimiter.model.UserBehavior;
import com.adaptivelimiter.store.CounterStore;
import com.adaptivelimiter.store.StoreUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AdaptiveDecisionRecorderTest {

    @Mock
    private CounterStore counterStore;

    private SimpleMeterRegistry meterRegistry;
    private AdaptiveDecisionRecorder recorder;

    private final AdaptiveDecision decision = AdaptiveDecision.builder()
            .policy("enterprise-tier")
            .userId("u1")
            .ip("10.0.0.1")
            .originalLimit(10_000)
            .adjustedLimit(12_000)
            .multiplier(1.2)
            .userBehavior(UserBehavior.defaults())
            .systemLoad(SystemLoad.defaults())
            .allowed(true)
            .timestamp(Instant.ofEpochMilli(1_700_000_000_123L))
            .build();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        recorder = new AdaptiveDecisionRecorder(counterStore, new ObjectMapper().findAndRegisterModules(),
                new MetricsService(meterRegistry));
    }

    @Test
    void shouldStoreDecisionAsJsonWithOneHourTtl() {
        // When
        recorder.record(decision);

        // Then
        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(counterStore).set(key.capture(), json.capture(), eq(Duration.ofHours(1)));
        assertThat(key.getValue()).matches("adaptive:log:1700000000123:[0-9a-f]{8}");
        assertThat(json.getValue())
                .contains("\"policy\":\"enterprise-tier\"")
                .contains("\"adjustedLimit\":12000")
                .contains("\"reputation\":0.7");
        assertThat(meterRegistry.counter("ratelimit.adaptive.decisions", "result", "allowed").count())
                .isEqualTo(1.0);
    }

    @Test
    void decisionsInSameMillisecondShouldGetDistinctKeys() {
        // When
        recorder.record(decision);
        recorder.record(decision);

        // Then
        ArgumentCaptor<String> keys = ArgumentCaptor.forClass(String.class);
        verify(counterStore, times(2)).set(keys.capture(), anyString(), eq(Duration.ofHours(1)));
        assertThat(keys.getAllValues()).doesNotHaveDuplicates()
                .allMatch(k -> k.startsWith("adaptive:log:1700000000123:"));
    }

    @Test
    void storeFailureShouldNotPropagate() {
        // Given
        doThrow(new StoreUnavailableException("down"))
                .when(counterStore).set(anyString(), anyString(), any());

        // Then
        assertThatCode(() -> recorder.record(decision)).doesNotThrowAnyException();
    }
}
