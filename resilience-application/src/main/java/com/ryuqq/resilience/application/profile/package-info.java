/**
 * 서비스 유형 프로필과 작업별 타임아웃 카탈로그.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.profile;
