package com.ryuqq.resilience.core.protection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CircuitBreakerConfig / BulkheadConfig 유효성 검증 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class CircuitBreakerConfigTest {

    @Test
    void 기본_생성자는_기본값을_사용함() {
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        assertThat(config.failureThreshold()).isEqualTo(5);
        assertThat(config.windowMs()).isEqualTo(60_000);
        assertThat(config.resetTimeoutMs()).isEqualTo(30_000);
        assertThat(config.timeoutMs()).isEqualTo(3_000);
    }

    @Test
    void failureThreshold가_0이면_예외() {
        assertThatThrownBy(() -> new CircuitBreakerConfig(0, 1000, 1000, 1000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("failureThreshold must be positive (current: 0)");
    }

    @Test
    void 음수_timeoutMs는_예외지만_0은_타임아웃_없음으로_허용() {
        assertThatThrownBy(() -> new CircuitBreakerConfig().withTimeoutMs(-1))
            .isInstanceOf(IllegalArgumentException.class);

        assertThat(new CircuitBreakerConfig().withTimeoutMs(0).timeoutMs()).isZero();
    }

    @Test
    void with_메서드는_해당_필드만_변경함() {
        CircuitBreakerConfig config = new CircuitBreakerConfig()
            .withFailureThreshold(3)
            .withWindowMs(10_000)
            .withResetTimeoutMs(5_000)
            .withTimeoutMs(1_000);

        assertThat(config).isEqualTo(new CircuitBreakerConfig(3, 10_000, 5_000, 1_000));
    }

    @Test
    void BulkheadConfig_등급별_기본값() {
        assertThat(BulkheadConfig.forTier(BulkheadTier.CRITICAL))
            .isEqualTo(new BulkheadConfig(20, 40, BulkheadTier.CRITICAL));
        assertThat(new BulkheadConfig())
            .isEqualTo(new BulkheadConfig(10, 20, BulkheadTier.STANDARD));
        assertThat(BulkheadConfig.forTier(BulkheadTier.OPTIONAL))
            .isEqualTo(new BulkheadConfig(4, 4, BulkheadTier.OPTIONAL));
    }

    @Test
    void BulkheadConfig_잘못된_값은_예외() {
        assertThatThrownBy(() -> new BulkheadConfig(0, 1, BulkheadTier.STANDARD))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxConcurrent");
        assertThatThrownBy(() -> new BulkheadConfig(1, -1, BulkheadTier.STANDARD))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxQueueSize");
        assertThatThrownBy(() -> BulkheadConfig.forTier(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("tier cannot be null");
    }

    @Test
    void CircuitPermit_음수_시험_식별자는_거부() {
        assertThatThrownBy(() -> new CircuitPermit(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("current: -1");
        assertThat(CircuitPermit.STANDARD.isTrial()).isFalse();
        assertThat(new CircuitPermit(7).isTrial()).isTrue();
    }
}
