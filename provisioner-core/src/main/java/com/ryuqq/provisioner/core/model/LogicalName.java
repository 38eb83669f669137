package com.ryuqq.provisioner.core.model;

/**
 * 한 번의 프로비저닝 실행 안에서 리소스를 식별하는 논리 이름.
 *
 * <p>프로젝트 이름으로부터 결정적으로 파생됩니다 (예: {@code demo-vpc}, {@code demo-asg}).
 * 프로바이더 측 재사용 조회(lookup-by-name)의 키로도 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class LogicalName implements Comparable<LogicalName> {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private LogicalName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("LogicalName cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("LogicalName length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException(
                "LogicalName contains invalid characters: '" + value + "'. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * LogicalName 생성.
     *
     * @param value 논리 이름 값
     * @return LogicalName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static LogicalName of(String value) {
        return new LogicalName(value);
    }

    /**
     * 논리 이름 값 조회.
     *
     * @return 논리 이름 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(LogicalName other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LogicalName that = (LogicalName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
