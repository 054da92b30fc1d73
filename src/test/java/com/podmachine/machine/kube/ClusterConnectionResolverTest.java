package com.podmachine.machine.kube;

import com.podmachine.machine.MachineConfigurationException;
import io.fabric8.kubernetes.client.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class ClusterConnectionResolverTest {

    private static final String KUBECONFIG = """
            apiVersion: v1
            kind: Config
            clusters:
            - name: test
              cluster:
                server: https://k8s.example.com:6443
                insecure-skip-tls-verify: true
            contexts:
            - name: test
              context:
                cluster: test
                user: tester
                namespace: machines
            current-context: test
            users:
            - name: tester
              user:
                token: abc123
            """;

    private final ClusterConnectionResolver resolver = new ClusterConnectionResolver("podmachine");

    private static String encode(String kubeconfig) {
        return Base64.getEncoder().encodeToString(kubeconfig.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("decodes a base64 kubeconfig")
    void decodesToken() {
        Config config = resolver.loadConfig(encode(KUBECONFIG));

        assertTrue(config.getMasterUrl().startsWith("https://k8s.example.com:6443"));
        assertEquals("machines", config.getNamespace());
        assertEquals("abc123", config.getOauthToken());
    }

    @Test
    @DisplayName("tolerates line-wrapped base64")
    void wrappedToken() {
        String encoded = encode(KUBECONFIG);
        String wrapped = encoded.substring(0, 40) + "\n" + encoded.substring(40);

        assertEquals("machines", resolver.loadConfig(wrapped).getNamespace());
    }

    @Test
    @DisplayName("resolves the namespace from the current context")
    void resolvesConnection() {
        try (ClusterConnection connection = resolver.resolve(encode(KUBECONFIG))) {
            assertEquals("machines", connection.namespace());
            assertTrue(connection.masterUrl().startsWith("https://k8s.example.com:6443"));
            assertInstanceOf(Fabric8ClusterGateway.class, connection.gateway());
        }
    }

    @Test
    @DisplayName("falls back to the default namespace")
    void defaultNamespace() {
        String withoutNamespace = KUBECONFIG.replace("    namespace: machines\n", "");

        try (ClusterConnection connection = resolver.resolve(encode(withoutNamespace))) {
            assertEquals(ClusterConnectionResolver.DEFAULT_NAMESPACE, connection.namespace());
        }
    }

    @Test
    @DisplayName("rejects a token that is not base64")
    void invalidBase64() {
        var ex = assertThrows(MachineConfigurationException.class, () -> resolver.loadConfig("%%% not base64 %%%"));
        assertTrue(ex.getMessage().contains("base64"));
    }

    @Test
    @DisplayName("rejects a token that is not a kubeconfig")
    void invalidKubeconfig() {
        assertThrows(MachineConfigurationException.class, () -> resolver.loadConfig(encode("clusters: [")));
    }

    @Test
    @DisplayName("blank token uses the standard lookup")
    void blankToken() {
        assertNotNull(resolver.loadConfig(" "));
    }
}
