package com.schemagov.store;

import java.io.IOException;
import java.util.List;

/**
 * Append-only record of governance decisions. Entries are never edited or removed.
 */
public interface AuditTrail {
    void append(AuditRecord record) throws IOException;

    List<AuditRecord> readAll() throws IOException;
}
