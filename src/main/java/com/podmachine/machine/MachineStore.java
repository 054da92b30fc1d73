package com.podmachine.machine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.podmachine.core.model.MachineRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File-backed store of machine records and their SSH material.
 *
 * <p>Layout: {@code <root>/machines/<name>/config.json}, {@code id_rsa} and
 * {@code id_rsa.pub} next to it.
 */
public class MachineStore {

    private static final Logger log = LoggerFactory.getLogger(MachineStore.class);

    static final String CONFIG_FILE = "config.json";
    static final String PRIVATE_KEY_FILE = "id_rsa";
    static final String PUBLIC_KEY_FILE = "id_rsa.pub";

    /** Machine names double as pod and secret names, so they must be DNS-1123 labels. */
    private static final Pattern VALID_NAME = Pattern.compile("[a-z0-9]([-a-z0-9]{0,61}[a-z0-9])?");

    private final Path root;
    private final ObjectMapper objectMapper;

    public MachineStore(Path root) {
        this.root = root;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static void validateName(String name) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new MachineConfigurationException("Invalid machine name '" + name
                    + "': use lowercase letters, digits and '-', at most 63 characters");
        }
    }

    public Path machinesDir() {
        return root.resolve("machines");
    }

    public Path machineDir(String name) {
        return machinesDir().resolve(name);
    }

    public Path privateKeyPath(String name) {
        return machineDir(name).resolve(PRIVATE_KEY_FILE);
    }

    public Path publicKeyPath(String name) {
        return machineDir(name).resolve(PUBLIC_KEY_FILE);
    }

    public boolean exists(String name) {
        return Files.isRegularFile(machineDir(name).resolve(CONFIG_FILE));
    }

    public void save(MachineRecord record) {
        validateName(record.name());
        Path dir = machineDir(record.name());
        try {
            Files.createDirectories(dir);
            objectMapper.writeValue(dir.resolve(CONFIG_FILE).toFile(), record);
        } catch (IOException e) {
            throw new MachineConfigurationException("Failed to save machine " + record.name() + " to " + dir, e);
        }
        log.debug("Saved machine {} to {}", record.name(), dir);
    }

    public Optional<MachineRecord> load(String name) {
        Path file = machineDir(name).resolve(CONFIG_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), MachineRecord.class));
        } catch (IOException e) {
            throw new MachineConfigurationException("Corrupt machine config " + file + ": " + e.getMessage(), e);
        }
    }

    public MachineRecord require(String name) {
        return load(name).orElseThrow(() ->
                new MachineConfigurationException("Machine " + name + " does not exist (run 'podmachine create " + name + "')"));
    }

    public List<MachineRecord> list() {
        Path machines = machinesDir();
        if (!Files.isDirectory(machines)) {
            return List.of();
        }
        var records = new ArrayList<MachineRecord>();
        try (Stream<Path> dirs = Files.list(machines)) {
            for (Path dir : dirs.sorted().toList()) {
                load(dir.getFileName().toString()).ifPresent(records::add);
            }
        } catch (IOException e) {
            throw new MachineConfigurationException("Failed to list machines in " + machines, e);
        }
        return records;
    }

    public void delete(String name) {
        Path dir = machineDir(name);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        } catch (IOException e) {
            throw new MachineConfigurationException("Failed to delete machine directory " + dir, e);
        }
        log.info("Removed local state of machine {}", name);
    }

    /**
     * Reads a whole file given by the user or written by this store.
     */
    public static byte[] readFile(Path path, String description) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new MachineConfigurationException("Cannot read " + description + " " + path + ": " + e.getMessage(), e);
        }
    }
}
