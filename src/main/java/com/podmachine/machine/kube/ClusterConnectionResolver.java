package com.podmachine.machine.kube;

import com.podmachine.machine.MachineConfigurationException;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Turns credential material into a {@link ClusterConnection}.
 *
 * <p>A base64 encoded kubeconfig is decoded in memory; without one, the standard
 * fabric8 lookup applies (KUBECONFIG, {@code ~/.kube/config}, in-cluster service account).
 * Nothing here contacts the API server.
 */
public class ClusterConnectionResolver {

    private static final Logger log = LoggerFactory.getLogger(ClusterConnectionResolver.class);

    static final String DEFAULT_NAMESPACE = "default";

    private final String fieldManager;

    public ClusterConnectionResolver(String fieldManager) {
        this.fieldManager = fieldManager;
    }

    public ClusterConnection resolve(String encodedKubeconfig) {
        Config config = loadConfig(encodedKubeconfig);
        String namespace = config.getNamespace() != null && !config.getNamespace().isBlank()
                ? config.getNamespace()
                : DEFAULT_NAMESPACE;
        KubernetesClient client = new KubernetesClientBuilder().withConfig(config).build();
        log.debug("Resolved cluster {} (namespace {})", config.getMasterUrl(), namespace);
        return new ClusterConnection(namespace, config.getMasterUrl(), new Fabric8ClusterGateway(client, fieldManager));
    }

    Config loadConfig(String encodedKubeconfig) {
        if (encodedKubeconfig == null || encodedKubeconfig.isBlank()) {
            return Config.autoConfigure(null);
        }
        String kubeconfig;
        try {
            byte[] decoded = Base64.getDecoder().decode(encodedKubeconfig.replaceAll("\\s", ""));
            kubeconfig = new String(decoded, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new MachineConfigurationException("Cannot decode base64 kubeconfig token", e);
        }
        try {
            return Config.fromKubeconfig(kubeconfig);
        } catch (RuntimeException e) {
            throw new MachineConfigurationException("Cannot load kubeconfig from token: " + e.getMessage(), e);
        }
    }
}
