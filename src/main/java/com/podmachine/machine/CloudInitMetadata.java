package com.podmachine.machine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Renders the NoCloud {@code meta-data} document for a machine.
 */
public final class CloudInitMetadata {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private CloudInitMetadata() {}

    public static byte[] forPublicKey(byte[] publicKey) {
        var document = Map.of("public-keys", List.of(new String(publicKey, StandardCharsets.UTF_8)));
        try {
            return OBJECT_MAPPER.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new MachineException("Failed to render cloud-init meta-data", e);
        }
    }
}
