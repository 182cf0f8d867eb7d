package com.ryuqq.deployer.core.model;

/**
 * Dead Letter Queue에 함께 기록되는 실패 정보.
 *
 * @param errorCode 오류 코드 (예: DEPLOYMENT_NOT_FOUND)
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public record Failure(
    String errorCode,
    String message,
    String cause
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Failure {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * Failure 생성 (cause 포함).
     */
    public static Failure of(String errorCode, String message, String cause) {
        return new Failure(errorCode, message, cause);
    }

    /**
     * cause 없이 Failure 생성.
     */
    public static Failure of(String errorCode, String message) {
        return new Failure(errorCode, message, null);
    }
}
