package com.podmachine.dispatch.cli;

import picocli.CommandLine.Option;

/**
 * Credential option shared by every command that talks to the cluster.
 */
public class ClusterOptions {

    @Option(names = "--kubernetes-k8token",
            description = "Base64 encoded kubeconfig (env: KUBERNETES_K8TOKEN)",
            defaultValue = "${env:KUBERNETES_K8TOKEN}")
    String kubeconfigToken;

    public String kubeconfigToken() {
        return kubeconfigToken;
    }
}
