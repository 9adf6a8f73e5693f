package com.schemagov.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class JsonLinesAuditTrail implements AuditTrail {
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final Path auditLogPath;

    public JsonLinesAuditTrail(Path auditLogPath) {
        this.auditLogPath = Objects.requireNonNull(auditLogPath, "auditLogPath");
    }

    @Override
    public synchronized void append(AuditRecord record) throws IOException {
        Objects.requireNonNull(record, "record");
        if (auditLogPath.getParent() != null) {
            Files.createDirectories(auditLogPath.getParent());
        }
        String line = mapper.writeValueAsString(record) + System.lineSeparator();
        Files.writeString(auditLogPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    @Override
    public List<AuditRecord> readAll() throws IOException {
        if (!Files.exists(auditLogPath)) {
            return List.of();
        }
        List<AuditRecord> records = new ArrayList<>();
        for (String line : Files.readAllLines(auditLogPath)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            records.add(mapper.readValue(line, AuditRecord.class));
        }
        return records;
    }
}
