package com.podmachine.machine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "podmachine")
public class MachineProperties {

    public static final String DEFAULT_IMAGE = "ghcr.io/william86370/rke2ink:systemd";

    private String driverName = "kubernetes";
    private String storePath = System.getProperty("user.home") + "/.podmachine";
    private String sshUser = "sles";
    private int sshPort = 22;
    private int dockerPort = 2376;
    private Workload workload = new Workload();
    private Cluster cluster = new Cluster();

    // -- Workload accessors (delegate to nested) --
    public String getImage() { return workload.image; }
    public String getUserData() { return workload.userData; }
    public String getCacheClaimName() { return workload.cacheClaimName; }
    public String getCacheMountPath() { return workload.cacheMountPath; }
    public String getMemoryLimit() { return workload.memoryLimit; }

    // -- Cluster accessors (delegate to nested) --
    public String getKubeconfigToken() { return cluster.kubeconfigToken; }
    public String getFieldManager() { return cluster.fieldManager; }
    public Duration getAddressTimeout() { return cluster.addressTimeout; }
    public Duration getDeleteTimeout() { return cluster.deleteTimeout; }

    /**
     * Returns the configured image, or {@link #DEFAULT_IMAGE} when none was set.
     */
    public String resolveImage(String override) {
        if (override != null && !override.isBlank()) {
            return override;
        }
        if (workload.image != null && !workload.image.isBlank()) {
            return workload.image;
        }
        return DEFAULT_IMAGE;
    }

    public String getDriverName() { return driverName; }
    public void setDriverName(String driverName) { this.driverName = driverName; }
    public String getStorePath() { return storePath; }
    public void setStorePath(String storePath) { this.storePath = storePath; }
    public String getSshUser() { return sshUser; }
    public void setSshUser(String sshUser) { this.sshUser = sshUser; }
    public int getSshPort() { return sshPort; }
    public void setSshPort(int sshPort) { this.sshPort = sshPort; }
    public int getDockerPort() { return dockerPort; }
    public void setDockerPort(int dockerPort) { this.dockerPort = dockerPort; }
    public Workload getWorkload() { return workload; }
    public void setWorkload(Workload workload) { this.workload = workload; }
    public Cluster getCluster() { return cluster; }
    public void setCluster(Cluster cluster) { this.cluster = cluster; }

    public static class Workload {
        private String image = DEFAULT_IMAGE;
        private String userData = "";
        private String cacheClaimName = "k8-core";
        private String cacheMountPath = "/var/lib/rancher";
        private String memoryLimit = "2Gi";

        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public String getUserData() { return userData; }
        public void setUserData(String userData) { this.userData = userData; }
        public String getCacheClaimName() { return cacheClaimName; }
        public void setCacheClaimName(String cacheClaimName) { this.cacheClaimName = cacheClaimName; }
        public String getCacheMountPath() { return cacheMountPath; }
        public void setCacheMountPath(String cacheMountPath) { this.cacheMountPath = cacheMountPath; }
        public String getMemoryLimit() { return memoryLimit; }
        public void setMemoryLimit(String memoryLimit) { this.memoryLimit = memoryLimit; }
    }

    public static class Cluster {
        /** Base64 encoded kubeconfig; empty means the standard kubeconfig lookup. */
        private String kubeconfigToken = "";
        private String fieldManager = "podmachine";
        private Duration addressTimeout = Duration.ofMinutes(5);
        private Duration deleteTimeout = Duration.ofMinutes(2);

        public String getKubeconfigToken() { return kubeconfigToken; }
        public void setKubeconfigToken(String kubeconfigToken) { this.kubeconfigToken = kubeconfigToken; }
        public String getFieldManager() { return fieldManager; }
        public void setFieldManager(String fieldManager) { this.fieldManager = fieldManager; }
        public Duration getAddressTimeout() { return addressTimeout; }
        public void setAddressTimeout(Duration addressTimeout) { this.addressTimeout = addressTimeout; }
        public Duration getDeleteTimeout() { return deleteTimeout; }
        public void setDeleteTimeout(Duration deleteTimeout) { this.deleteTimeout = deleteTimeout; }
    }
}
