/**
 * 환경 변수 설정 로딩.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.config;
