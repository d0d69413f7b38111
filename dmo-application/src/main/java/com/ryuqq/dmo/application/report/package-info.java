/**
 * 리포트 계산 (일간, 월간, 기간 요약, 연속 달성).
 *
 * @since 1.0.0
 * @author DMO Team
 */
package com.ryuqq.dmo.application.report;
