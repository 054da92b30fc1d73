package com.podmachine.machine;

import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.KeyPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Generates the RSA keypair a machine's cloud-init authorizes for SSH.
 */
public class SshKeyGenerator {

    private static final Logger log = LoggerFactory.getLogger(SshKeyGenerator.class);

    static final int KEY_SIZE = 2048;

    /**
     * Writes {@code privateKeyPath} and {@code privateKeyPath + ".pub"}.
     */
    public void generate(Path privateKeyPath, String comment) {
        JSch jsch = new JSch();
        KeyPair keyPair = null;
        try {
            Files.createDirectories(privateKeyPath.getParent());
            keyPair = KeyPair.genKeyPair(jsch, KeyPair.RSA, KEY_SIZE);
            keyPair.writePrivateKey(privateKeyPath.toString());
            keyPair.writePublicKey(privateKeyPath + ".pub", comment);
            log.info("Generated SSH key {}", privateKeyPath);
        } catch (JSchException | IOException e) {
            throw new MachineConfigurationException("Failed to generate SSH key " + privateKeyPath, e);
        } finally {
            if (keyPair != null) {
                keyPair.dispose();
            }
        }
    }
}
