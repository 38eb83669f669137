package com.ryuqq.provisioner.core.spi;

/**
 * 생성 호출 결과.
 *
 * <p>키 페어 생성은 개인 키 자료를 정확히 한 번 반환합니다.
 * 그 외 종류는 {@code keyMaterial}이 null입니다.</p>
 *
 * @param id 프로바이더 식별자
 * @param keyMaterial 개인 키 자료 (키 페어 외에는 null)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record CreatedResource(
    String id,
    String keyMaterial
) {

    public CreatedResource {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
    }

    public static CreatedResource of(String id) {
        return new CreatedResource(id, null);
    }

    public static CreatedResource withKeyMaterial(String id, String keyMaterial) {
        return new CreatedResource(id, keyMaterial);
    }

    public boolean hasKeyMaterial() {
        return keyMaterial != null && !keyMaterial.isEmpty();
    }

    @Override
    public String toString() {
        return "CreatedResource{id=" + id + ", keyMaterial=" + (hasKeyMaterial() ? "<redacted>" : "none") + '}';
    }
}
