/**
 * Protection SPI의 NoOp 구현.
 *
 * <p>비활성화된 보호 계층 자리에 들어가 함수를 그대로 통과시킵니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.protection.noop;
