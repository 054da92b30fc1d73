package com.podmachine.machine;

import com.podmachine.machine.kube.ClusterConnectionResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class MachineConfig {

    @Bean
    public MachineStore machineStore(MachineProperties properties) {
        return new MachineStore(Path.of(properties.getStorePath()));
    }

    @Bean
    public SshKeyGenerator sshKeyGenerator() {
        return new SshKeyGenerator();
    }

    @Bean
    public ClusterConnectionResolver clusterConnectionResolver(MachineProperties properties) {
        return new ClusterConnectionResolver(properties.getFieldManager());
    }
}
