/**
 * 호출자용 유스케이스 패키지.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.stylebatch.application.service;
