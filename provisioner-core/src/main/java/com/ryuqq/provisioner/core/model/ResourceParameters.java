package com.ryuqq.provisioner.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 리소스 생성 파라미터의 불변 매핑.
 *
 * <p>허용 값 타입: {@link String}, {@link Integer}, {@link Boolean},
 * {@code List<String>}, {@code List<IngressRule>}. 그 외 타입은 생성 시점에 거부됩니다.</p>
 *
 * <p>타입별 조회 메서드는 키가 없거나 타입이 다르면 {@link IllegalArgumentException}을 던집니다.
 * 어댑터가 잘못된 계획을 조용히 받아들이지 않도록 하기 위함입니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ResourceParameters {

    private static final ResourceParameters EMPTY = new ResourceParameters(Map.of());

    private final Map<String, Object> values;

    private ResourceParameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * 빈 파라미터.
     *
     * @return 빈 ResourceParameters
     */
    public static ResourceParameters empty() {
        return EMPTY;
    }

    /**
     * 매핑으로부터 생성.
     *
     * @param values 파라미터 매핑
     * @return ResourceParameters 인스턴스
     * @throws IllegalArgumentException 키/값이 null이거나 허용되지 않는 타입인 경우
     */
    public static ResourceParameters of(Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> copy.put(key, checked(key, value)));
        return new ResourceParameters(copy);
    }

    /**
     * 값 하나를 추가(또는 교체)한 새 인스턴스 생성.
     *
     * @param key 파라미터 이름
     * @param value 값
     * @return 새 ResourceParameters
     */
    public ResourceParameters with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, checked(key, value));
        return new ResourceParameters(copy);
    }

    /**
     * 다른 파라미터와 병합한 새 인스턴스 생성 (other 값이 우선).
     *
     * @param other 병합할 파라미터
     * @return 병합된 ResourceParameters
     */
    public ResourceParameters merge(ResourceParameters other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.putAll(other.values);
        return new ResourceParameters(copy);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public String getString(String key) {
        return require(key, String.class);
    }

    /**
     * 문자열 값 조회 (없으면 null).
     */
    public String getStringOrNull(String key) {
        return values.containsKey(key) ? require(key, String.class) : null;
    }

    public int getInt(String key) {
        return require(key, Integer.class);
    }

    public boolean getBoolean(String key) {
        return require(key, Boolean.class);
    }

    /**
     * 불리언 값 조회 (없으면 기본값).
     */
    public boolean getBooleanOrDefault(String key, boolean defaultValue) {
        return values.containsKey(key) ? require(key, Boolean.class) : defaultValue;
    }

    public List<String> getStringList(String key) {
        List<?> list = require(key, List.class);
        for (Object element : list) {
            if (!(element instanceof String)) {
                throw new IllegalArgumentException("parameter '" + key + "' is not a list of strings");
            }
        }
        return list.stream().map(String.class::cast).toList();
    }

    public List<IngressRule> getIngressRules(String key) {
        if (!values.containsKey(key)) {
            return List.of();
        }
        List<?> list = require(key, List.class);
        for (Object element : list) {
            if (!(element instanceof IngressRule)) {
                throw new IllegalArgumentException("parameter '" + key + "' is not a list of ingress rules");
            }
        }
        return list.stream().map(IngressRule.class::cast).toList();
    }

    private <T> T require(String key, Class<T> type) {
        Object value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("missing parameter: " + key);
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(
                "parameter '" + key + "' is " + value.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(value);
    }

    private static Object checked(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("parameter key cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("parameter '" + key + "' cannot be null");
        }
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (!(element instanceof String) && !(element instanceof IngressRule)) {
                    throw new IllegalArgumentException("parameter '" + key + "' contains unsupported element type");
                }
            }
            return List.copyOf(list);
        }
        if (value instanceof String || value instanceof Integer || value instanceof Boolean) {
            return value;
        }
        throw new IllegalArgumentException(
            "parameter '" + key + "' has unsupported type " + value.getClass().getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((ResourceParameters) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceParameters" + values;
    }
}
