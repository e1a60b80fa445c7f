package com.flagship.debt_ledger.repayment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON form of the repayment log.
 *
 * <pre>
 * {
 *   "entries": [
 *     {"positionId": "...", "appliedCount": 3, "cachedBalance": 4650.12,
 *      "cumulativeInterest": 150.12, "cumulativePrincipal": 349.88,
 *      "lastSyncedAt": "2025-03-16T00:00:00Z"}
 *   ],
 *   "updatedAt": "2025-03-16T00:00:00Z"
 * }
 * </pre>
 *
 * Decoding rejects documents that are not JSON or whose shape is wrong
 * instead of throwing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RepaymentLogCodec {

    private static final String ENTRIES = "entries";
    private static final String UPDATED_AT = "updatedAt";
    private static final String POSITION_ID = "positionId";
    private static final String APPLIED_COUNT = "appliedCount";
    private static final String CACHED_BALANCE = "cachedBalance";
    private static final String CUMULATIVE_INTEREST = "cumulativeInterest";
    private static final String CUMULATIVE_PRINCIPAL = "cumulativePrincipal";
    private static final String LAST_SYNCED_AT = "lastSyncedAt";

    private final ObjectMapper objectMapper;

    /**
     * Serializes the log.
     */
    public String encode(RepaymentLog repaymentLog) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode entries = root.putArray(ENTRIES);

        for (RepaymentLogEntry entry : repaymentLog.getEntries()) {
            ObjectNode node = entries.addObject();
            node.put(POSITION_ID, entry.getPositionId());
            node.put(APPLIED_COUNT, entry.getAppliedCount());
            node.put(CACHED_BALANCE, entry.getCachedBalance());
            node.put(CUMULATIVE_INTEREST, entry.getCumulativeInterest());
            node.put(CUMULATIVE_PRINCIPAL, entry.getCumulativePrincipal());
            if (entry.getLastSyncedAt() != null) {
                node.put(LAST_SYNCED_AT, entry.getLastSyncedAt().toString());
            }
        }
        root.put(UPDATED_AT, repaymentLog.getUpdatedAt().toString());

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize repayment log: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a stored document.
     *
     * @return The log, or empty if the document is not JSON or has an invalid shape
     */
    public Optional<RepaymentLog> decode(String document) {
        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            log.warn("Repayment log is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        if (!hasValidShape(root)) {
            log.warn("Repayment log has an invalid shape");
            return Optional.empty();
        }

        try {
            List<RepaymentLogEntry> entries = new ArrayList<>();
            for (JsonNode node : root.get(ENTRIES)) {
                entries.add(toEntry(node));
            }
            return Optional.of(new RepaymentLog(entries, Instant.parse(root.get(UPDATED_AT).asText())));
        } catch (DateTimeParseException e) {
            log.warn("Repayment log has an unreadable timestamp: {}", e.getParsedString());
            return Optional.empty();
        }
    }

    private boolean hasValidShape(JsonNode root) {
        if (root == null || !root.isObject()) {
            return false;
        }
        if (!root.path(ENTRIES).isArray() || !root.path(UPDATED_AT).isTextual()) {
            return false;
        }

        for (JsonNode entry : root.get(ENTRIES)) {
            if (!entry.isObject()) {
                return false;
            }
            if (!entry.path(POSITION_ID).isTextual()
                    || !entry.path(APPLIED_COUNT).isNumber()
                    || !entry.path(CACHED_BALANCE).isNumber()) {
                return false;
            }
        }
        return true;
    }

    private RepaymentLogEntry toEntry(JsonNode node) {
        JsonNode lastSyncedAt = node.path(LAST_SYNCED_AT);
        return new RepaymentLogEntry(
            node.get(POSITION_ID).asText(),
            node.get(APPLIED_COUNT).asInt(),
            node.get(CACHED_BALANCE).decimalValue(),
            decimalOrZero(node.path(CUMULATIVE_INTEREST)),
            decimalOrZero(node.path(CUMULATIVE_PRINCIPAL)),
            lastSyncedAt.isTextual() ? Instant.parse(lastSyncedAt.asText()) : null
        );
    }

    private BigDecimal decimalOrZero(JsonNode node) {
        return node.isNumber() ? node.decimalValue() : BigDecimal.ZERO;
    }
}
