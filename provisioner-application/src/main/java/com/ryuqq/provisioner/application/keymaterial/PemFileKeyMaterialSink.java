package com.ryuqq.provisioner.application.keymaterial;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.spi.KeyMaterialSink;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;

/**
 * 키 자료를 {@code {keyName}.pem} 파일로 저장하는 싱크.
 *
 * <p>POSIX 파일 시스템에서는 소유자 읽기 전용(0400)으로 권한을 낮춥니다.
 * 같은 이름의 파일이 있으면 교체합니다 (키 자료는 키 페어가 새로 생성될 때만 전달됨).</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class PemFileKeyMaterialSink implements KeyMaterialSink {

    private final Path directory;

    public PemFileKeyMaterialSink(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        this.directory = directory;
    }

    /**
     * 키 이름에 대응하는 PEM 파일 경로.
     *
     * @param keyName 키 페어 논리 이름
     * @return PEM 파일 경로
     */
    public Path pemFileFor(LogicalName keyName) {
        return directory.resolve(keyName.getValue() + ".pem");
    }

    /**
     * @throws UncheckedIOException 파일을 쓸 수 없는 경우
     */
    @Override
    public void accept(LogicalName keyName, String material) {
        if (keyName == null) {
            throw new IllegalArgumentException("keyName cannot be null");
        }
        if (material == null || material.isEmpty()) {
            throw new IllegalArgumentException("material cannot be null or empty");
        }
        Path pem = pemFileFor(keyName);
        try {
            Files.createDirectories(directory);
            Files.deleteIfExists(pem);
            Files.writeString(pem, material, StandardCharsets.UTF_8);
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                Files.setPosixFilePermissions(pem, EnumSet.of(PosixFilePermission.OWNER_READ));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write key material to " + pem, e);
        }
    }
}
