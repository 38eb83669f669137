package com.ryuqq.provisioner.application.config;

import com.ryuqq.provisioner.core.config.FleetPlacement;
import com.ryuqq.provisioner.core.config.ProvisioningConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * {@link Properties}에서 {@link ProvisioningConfig} 로드.
 *
 * <p>없는 키는 {@link ProvisioningConfig#ProvisioningConfig()}의 기본값을 사용합니다.
 * 목록 값은 쉼표로 구분합니다.</p>
 *
 * <p><strong>지원 키:</strong></p>
 * <ul>
 *   <li>{@code provisioner.project}, {@code provisioner.region}, {@code provisioner.zone-count}</li>
 *   <li>{@code provisioner.vpc-cidr}, {@code provisioner.public-subnet-cidrs}, {@code provisioner.private-subnet-cidrs}</li>
 *   <li>{@code provisioner.image-id}, {@code provisioner.instance-type}</li>
 *   <li>{@code provisioner.boot-script} (평문) 또는 {@code provisioner.boot-script-resource} (클래스패스 리소스)</li>
 *   <li>{@code provisioner.min-size}, {@code provisioner.max-size}, {@code provisioner.desired-capacity}</li>
 *   <li>{@code provisioner.ssh-ingress-cidr}, {@code provisioner.fleet-placement} (PRIVATE | PUBLIC)</li>
 *   <li>{@code provisioner.http-port}, {@code provisioner.health-check-path}</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ProvisioningConfigLoader {

    static final String PREFIX = "provisioner.";

    private ProvisioningConfigLoader() {
    }

    /**
     * 클래스패스 리소스에서 로드.
     *
     * @param resource 리소스 경로 (예: "provisioner.properties")
     * @return ProvisioningConfig
     * @throws IllegalArgumentException 리소스가 없거나 값이 유효하지 않은 경우
     */
    public static ProvisioningConfig fromClasspath(String resource) {
        try (InputStream in = openResource(resource)) {
            Properties properties = new Properties();
            properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    /**
     * 파일에서 로드.
     *
     * @param file properties 파일
     * @return ProvisioningConfig
     * @throws UncheckedIOException 파일을 읽을 수 없는 경우
     */
    public static ProvisioningConfig fromFile(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Properties properties = new Properties();
            properties.load(reader);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    /**
     * Properties에서 로드.
     *
     * @param properties 설정 값
     * @return ProvisioningConfig
     * @throws IllegalArgumentException 값이 유효하지 않은 경우 (키 이름 포함)
     */
    public static ProvisioningConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        ProvisioningConfig defaults = new ProvisioningConfig();

        String bootScript = string(properties, "boot-script", null);
        String bootScriptResource = string(properties, "boot-script-resource", null);
        if (bootScript == null) {
            bootScript = bootScriptResource != null ? readResource(bootScriptResource) : defaults.bootScript();
        }

        return new ProvisioningConfig(
            string(properties, "project", defaults.project()),
            string(properties, "region", defaults.region()),
            integer(properties, "zone-count", defaults.zoneCount()),
            string(properties, "vpc-cidr", defaults.vpcCidr()),
            list(properties, "public-subnet-cidrs", defaults.publicSubnetCidrs()),
            list(properties, "private-subnet-cidrs", defaults.privateSubnetCidrs()),
            string(properties, "image-id", defaults.imageId()),
            string(properties, "instance-type", defaults.instanceType()),
            bootScript,
            integer(properties, "min-size", defaults.minSize()),
            integer(properties, "max-size", defaults.maxSize()),
            integer(properties, "desired-capacity", defaults.desiredCapacity()),
            string(properties, "ssh-ingress-cidr", defaults.sshIngressCidr()),
            placement(properties, defaults.fleetPlacement()),
            integer(properties, "http-port", defaults.httpPort()),
            string(properties, "health-check-path", defaults.healthCheckPath())
        );
    }

    private static String string(Properties properties, String key, String defaultValue) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }

    private static int integer(Properties properties, String key, int defaultValue) {
        String value = string(properties, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " must be an integer (current: " + value + ")", e);
        }
    }

    private static List<String> list(Properties properties, String key, List<String> defaultValue) {
        String value = string(properties, key, null);
        if (value == null) {
            return defaultValue;
        }
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    private static FleetPlacement placement(Properties properties, FleetPlacement defaultValue) {
        String value = string(properties, "fleet-placement", null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return FleetPlacement.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                PREFIX + "fleet-placement must be PRIVATE or PUBLIC (current: " + value + ")", e);
        }
    }

    private static String readResource(String resource) {
        try (InputStream in = openResource(resource)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    private static InputStream openResource(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource cannot be null or blank");
        }
        InputStream in = ProvisioningConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("classpath resource not found: " + resource);
        }
        return in;
    }
}
