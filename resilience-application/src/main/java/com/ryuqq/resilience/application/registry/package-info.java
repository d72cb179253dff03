/**
 * 이름 기반 ResilienceManager 레지스트리와 헬스 집계.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.registry;
