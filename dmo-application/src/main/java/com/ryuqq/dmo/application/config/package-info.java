/**
 * 저장소 선택 설정과 백엔드 팩토리.
 *
 * @since 1.0.0
 * @author DMO Team
 */
package com.ryuqq.dmo.application.config;
