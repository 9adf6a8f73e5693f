package com.schemagov.detect;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic mapping from detector rule codes to impact tiers and migration notes. Both the legacy
 * {@code *_REMOVED}/{@code *_CHANGED} codes and buf's rule identifiers are recognised.
 */
public final class BreakingChangeRules {
    private static final Set<String> CRITICAL = Set.of(
            "FILE_NO_DELETE",
            "PACKAGE_NO_DELETE",
            "FILE_SAME_PACKAGE");

    private static final Set<String> HIGH = Set.of(
            "FIELD_REMOVED",
            "MESSAGE_REMOVED",
            "SERVICE_REMOVED",
            "RPC_REMOVED",
            "ENUM_REMOVED",
            "ENUM_VALUE_REMOVED",
            "FIELD_NO_DELETE",
            "FIELD_NO_DELETE_UNLESS_NUMBER_RESERVED",
            "FIELD_NO_DELETE_UNLESS_NAME_RESERVED",
            "MESSAGE_NO_DELETE",
            "SERVICE_NO_DELETE",
            "RPC_NO_DELETE",
            "ENUM_NO_DELETE",
            "ENUM_VALUE_NO_DELETE",
            "ENUM_VALUE_NO_DELETE_UNLESS_NUMBER_RESERVED",
            "ENUM_VALUE_NO_DELETE_UNLESS_NAME_RESERVED");

    private static final Set<String> MEDIUM = Set.of(
            "FIELD_TYPE_CHANGED",
            "FIELD_CARDINALITY_CHANGED",
            "RPC_REQUEST_TYPE_CHANGED",
            "RPC_RESPONSE_TYPE_CHANGED",
            "FIELD_SAME_TYPE",
            "FIELD_SAME_CARDINALITY",
            "FIELD_SAME_LABEL",
            "RPC_SAME_REQUEST_TYPE",
            "RPC_SAME_RESPONSE_TYPE");

    private static final Map<String, String> NOTES_BY_SUBJECT = Map.of(
            "FILE", "A schema file or package was removed or moved. Every importer must switch to the new location before release.",
            "PACKAGE", "A schema file or package was removed or moved. Every importer must switch to the new location before release.",
            "FIELD", "Field contract changed. Stop reading or writing the field in consumers, then reserve its number and name.",
            "MESSAGE", "Message removed. Replace references with the successor message and regenerate client code.",
            "SERVICE", "Service removed. Route callers to the replacement service before the old one is retired.",
            "RPC", "RPC signature changed or removed. Add a new RPC alongside the old one and migrate callers incrementally.",
            "ENUM", "Enum contract changed. Handle unknown values in consumers and reserve removed numbers.");

    private static final String DEFAULT_NOTE = "Review the change with consuming teams and update generated code.";

    private BreakingChangeRules() {
    }

    public static ImpactTier impactFor(String type) {
        String code = normalize(type);
        if (CRITICAL.contains(code)) {
            return ImpactTier.CRITICAL;
        }
        if (HIGH.contains(code)) {
            return ImpactTier.HIGH;
        }
        if (MEDIUM.contains(code)) {
            return ImpactTier.MEDIUM;
        }
        return ImpactTier.LOW;
    }

    public static String migrationNoteFor(String type) {
        String code = normalize(type);
        if (code.startsWith("ENUM_VALUE")) {
            return NOTES_BY_SUBJECT.get("ENUM");
        }
        int separator = code.indexOf('_');
        String subject = separator < 0 ? code : code.substring(0, separator);
        return NOTES_BY_SUBJECT.getOrDefault(subject, DEFAULT_NOTE);
    }

    private static String normalize(String type) {
        return type == null ? "" : type.trim().toUpperCase(Locale.ROOT);
    }
}
