package com.podmachine.core.model;

import java.time.Instant;

/**
 * Locally persisted configuration of a machine, written at create time and
 * re-read by every later command. Runtime state such as the address is never stored.
 *
 * @param name         machine name
 * @param driverName   driver that owns the machine
 * @param image        container image reference
 * @param userDataPath optional cloud-init user-data file, {@code null} when unset
 * @param sshUser      user for SSH access into the machine
 * @param sshPort      SSH port exposed by the workload
 * @param createdAt    creation time
 */
public record MachineRecord(
    String name,
    String driverName,
    String image,
    String userDataPath,
    String sshUser,
    int sshPort,
    Instant createdAt
) {
    public boolean hasUserData() {
        return userDataPath != null && !userDataPath.isBlank();
    }
}
