/**
 * 루틴 추적 서비스 파사드.
 *
 * @since 1.0.0
 * @author DMO Team
 */
package com.ryuqq.dmo.application.service;
