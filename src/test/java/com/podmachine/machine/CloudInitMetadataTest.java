package com.podmachine.machine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CloudInitMetadataTest {

    @Test
    void listsThePublicKey() throws Exception {
        byte[] json = CloudInitMetadata.forPublicKey("ssh-rsa AAAAB3Nza sles@demo\n".getBytes(StandardCharsets.UTF_8));

        JsonNode node = new ObjectMapper().readTree(json);
        assertTrue(node.get("public-keys").isArray());
        assertEquals(1, node.get("public-keys").size());
        assertEquals("ssh-rsa AAAAB3Nza sles@demo\n", node.get("public-keys").get(0).asText());
    }
}
