package com.podmachine.machine;

import io.fabric8.kubernetes.api.model.ContainerPort;
import io.fabric8.kubernetes.api.model.ContainerPortBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the pod and secret that represent a machine.
 *
 * <p>The cloud-init payloads always travel in the secret and are mounted into the
 * NoCloud seed directory by sub-path, so the pod spec stays the same whatever the
 * payloads contain. Building has no side effects.
 */
public class MachineObjectBuilder {

    public static final String CONTAINER_NAME = "machine";
    public static final String CACHE_VOLUME = "cache-volume";
    public static final String DATA_VOLUME = "data";
    public static final String USER_DATA_KEY = "user-data";
    public static final String META_DATA_KEY = "meta-data";
    public static final String SEED_DIR = "/var/lib/cloud/seed/nocloud/";
    public static final String USER_DATA_PATH = SEED_DIR + USER_DATA_KEY;
    public static final String META_DATA_PATH = SEED_DIR + META_DATA_KEY;

    enum MachinePort {
        SSH("ssh", 22),
        KUBE_API("kube-api", 6443),
        ENDPOINT("endpoint", 9435),
        HTTPS("https", 443),
        HTTP("http", 80);

        final String portName;
        final int port;

        MachinePort(String portName, int port) {
            this.portName = portName;
            this.port = port;
        }
    }

    private final String cacheClaimName;
    private final String cacheMountPath;
    private final String memoryLimit;

    public MachineObjectBuilder(String cacheClaimName, String cacheMountPath, String memoryLimit) {
        this.cacheClaimName = cacheClaimName;
        this.cacheMountPath = cacheMountPath;
        this.memoryLimit = memoryLimit;
    }

    public static MachineObjectBuilder fromProperties(MachineProperties properties) {
        return new MachineObjectBuilder(properties.getCacheClaimName(),
                properties.getCacheMountPath(), properties.getMemoryLimit());
    }

    /**
     * Builds the desired objects for a machine.
     *
     * <p>Passing an empty image and {@code null} payloads yields the deletion sentinel:
     * objects with the right identity and an empty secret.
     */
    public DesiredObjectSet build(String namespace, String name, String image, byte[] userData, byte[] metaData) {
        return new DesiredObjectSet(
                buildWorkload(namespace, name, image),
                buildConfig(namespace, name, userData, metaData));
    }

    /**
     * Identity-only objects, used to tear a machine down.
     */
    public DesiredObjectSet sentinel(String namespace, String name) {
        return build(namespace, name, "", null, null);
    }

    private Pod buildWorkload(String namespace, String name, String image) {
        return new PodBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                .endMetadata()
                .withNewSpec()
                    .addNewVolume()
                        .withName(CACHE_VOLUME)
                        .withNewPersistentVolumeClaim()
                            .withClaimName(cacheClaimName)
                        .endPersistentVolumeClaim()
                    .endVolume()
                    .addNewVolume()
                        .withName(DATA_VOLUME)
                        .withNewSecret()
                            .withSecretName(name)
                        .endSecret()
                    .endVolume()
                    .addNewContainer()
                        .withName(CONTAINER_NAME)
                        .withImage(image != null ? image : "")
                        .withPorts(ports())
                        .addNewVolumeMount()
                            .withName(CACHE_VOLUME)
                            .withMountPath(cacheMountPath)
                        .endVolumeMount()
                        .addNewVolumeMount()
                            .withName(DATA_VOLUME)
                            .withMountPath(META_DATA_PATH)
                            .withSubPath(META_DATA_KEY)
                        .endVolumeMount()
                        .addNewVolumeMount()
                            .withName(DATA_VOLUME)
                            .withMountPath(USER_DATA_PATH)
                            .withSubPath(USER_DATA_KEY)
                        .endVolumeMount()
                        .withNewResources()
                            .addToLimits("memory", new Quantity(memoryLimit))
                        .endResources()
                        .withNewSecurityContext()
                            .withPrivileged(true)
                        .endSecurityContext()
                        .withStdin(true)
                        .withStdinOnce(true)
                        .withTty(true)
                    .endContainer()
                    .withRestartPolicy("Never")
                    .withAutomountServiceAccountToken(false)
                    .withHostname(name)
                    .withTerminationGracePeriodSeconds(0L)
                .endSpec()
                .build();
    }

    private Secret buildConfig(String namespace, String name, byte[] userData, byte[] metaData) {
        Map<String, String> data = new LinkedHashMap<>();
        // Both keys or neither: the pod mounts both sub-paths.
        if (userData != null || metaData != null) {
            data.put(USER_DATA_KEY, encode(userData));
            data.put(META_DATA_KEY, encode(metaData));
        }
        return new SecretBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                .endMetadata()
                .withType("Opaque")
                .withData(data)
                .build();
    }

    private static List<ContainerPort> ports() {
        var ports = new ArrayList<ContainerPort>();
        for (MachinePort p : MachinePort.values()) {
            ports.add(new ContainerPortBuilder()
                    .withName(p.portName)
                    .withContainerPort(p.port)
                    .build());
        }
        return ports;
    }

    private static String encode(byte[] payload) {
        return Base64.getEncoder().encodeToString(payload != null ? payload : new byte[0]);
    }
}
