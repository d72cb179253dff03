/**
 * 명시적 대체값(Graceful Degradation) 래퍼.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.degradation;
