package com.schemagov.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Versioned store persisted as a single JSON document. Writers are serialized by a lock and the file is
 * replaced atomically, so readers always see a complete snapshot.
 */
public class JsonFileVersionedStore<T> implements VersionedStore<T> {
    private final Path storePath;
    private final ObjectMapper mapper;
    private final JavaType documentType;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JsonFileVersionedStore(Path storePath, Class<T> valueType) {
        this(storePath, valueType, JsonMapper.builder().findAndAddModules().build());
    }

    JsonFileVersionedStore(Path storePath, Class<T> valueType, ObjectMapper mapper) {
        this.storePath = Objects.requireNonNull(storePath, "storePath");
        this.mapper = mapper;
        JavaType entryType = mapper.getTypeFactory().constructParametricType(Versioned.class, valueType);
        this.documentType = mapper.getTypeFactory().constructMapType(
                LinkedHashMap.class,
                mapper.getTypeFactory().constructType(String.class),
                entryType);
    }

    @Override
    public Optional<Versioned<T>> get(String key) throws IOException {
        return Optional.ofNullable(read().get(key));
    }

    @Override
    public Versioned<T> getOrCreate(String key, Supplier<T> initialValue) throws IOException {
        Versioned<T> existing = read().get(key);
        if (existing != null) {
            return existing;
        }
        writeLock.lock();
        try {
            Map<String, Versioned<T>> document = read();
            Versioned<T> current = document.get(key);
            if (current != null) {
                return current;
            }
            Versioned<T> created = new Versioned<>(1, initialValue.get());
            document.put(key, created);
            write(document);
            return created;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean compareAndSet(String key, long expectedVersion, T value) throws IOException {
        Objects.requireNonNull(value, "value");
        writeLock.lock();
        try {
            Map<String, Versioned<T>> document = read();
            Versioned<T> current = document.get(key);
            long currentVersion = current == null ? 0 : current.version();
            if (currentVersion != expectedVersion) {
                return false;
            }
            document.put(key, new Versioned<>(expectedVersion + 1, value));
            write(document);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Map<String, Versioned<T>> snapshot() throws IOException {
        return read();
    }

    private Map<String, Versioned<T>> read() throws IOException {
        if (!Files.exists(storePath) || Files.size(storePath) == 0) {
            return new LinkedHashMap<>();
        }
        Map<String, Versioned<T>> document = mapper.readValue(storePath.toFile(), documentType);
        return document == null ? new LinkedHashMap<>() : document;
    }

    private void write(Map<String, Versioned<T>> document) throws IOException {
        if (storePath.getParent() != null) {
            Files.createDirectories(storePath.getParent());
        }
        Path tempFile = storePath.resolveSibling(storePath.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), document);
        try {
            Files.move(tempFile, storePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, storePath, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
