// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.codec;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import sh.strata.core.error.RecordEncodingException;
import sh.strata.core.model.BlockRecord;

/**
 * JSON encoding of {@link BlockRecord}.
 *
 * <p>
 * The object uses snake_case field names:
 *
 * <pre>{@code
 * {
 *   "number": 12345678,
 *   "hash": "0x1234...",
 *   "parent_hash": "0xabcd...",
 *   "timestamp": 1704067200,
 *   "transactions": ["0x..."],
 *   "state_root": "0x..." | null,
 *   "extrinsics_root": "0x..." | null,
 *   "extrinsic_count": 2,
 *   "event_count": 6 | null,
 *   "is_finalized": true
 * }
 * }</pre>
 *
 * <p>
 * {@code number}, {@code hash}, {@code parent_hash}, {@code timestamp} and
 * {@code transactions} are required. The remaining fields were added later and decode to
 * {@code null}, {@code null}, {@code 0}, {@code null} and {@code false} when absent, so
 * payloads written before they existed still load. Unknown fields are ignored.
 *
 * @since 0.1.0
 */
public final class BlockRecordCodec {

    /**
     * Shared mapper; thread-safe once configured.
     */
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private BlockRecordCodec() {
        // Utility class
    }

    /**
     * Encodes a record as a JSON object.
     *
     * @param record the record to encode
     * @return the JSON text
     * @throws RecordEncodingException if serialization fails
     */
    public static String encode(final BlockRecord record) {
        Objects.requireNonNull(record, "record");
        final BlockRecordJson json = new BlockRecordJson(
                record.number(),
                record.hash(),
                record.parentHash(),
                record.timestamp(),
                record.transactions(),
                record.stateRoot(),
                record.extrinsicsRoot(),
                record.extrinsicCount(),
                record.eventCount(),
                record.finalized());
        try {
            return MAPPER.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new RecordEncodingException("Failed to encode block " + record.number(), e);
        }
    }

    /**
     * Decodes a JSON object produced by {@link #encode(BlockRecord)} or by an older writer
     * that predates the optional fields.
     *
     * @param json the JSON text
     * @return the decoded record
     * @throws RecordEncodingException if the text is not valid JSON, a required field is
     *                                 missing, or a hash is malformed
     */
    public static BlockRecord decode(final String json) {
        Objects.requireNonNull(json, "json");
        final BlockRecordJson parsed;
        try {
            parsed = MAPPER.readValue(json, BlockRecordJson.class);
        } catch (JsonProcessingException e) {
            throw new RecordEncodingException("Malformed block record JSON", e);
        }
        if (parsed == null) {
            throw new RecordEncodingException("Block record JSON is null", null);
        }

        try {
            return new BlockRecord(
                    required(parsed.number(), "number"),
                    required(parsed.hash(), "hash"),
                    required(parsed.parentHash(), "parent_hash"),
                    required(parsed.timestamp(), "timestamp"),
                    required(parsed.transactions(), "transactions"),
                    parsed.stateRoot(),
                    parsed.extrinsicsRoot(),
                    parsed.extrinsicCount() == null ? 0 : parsed.extrinsicCount(),
                    parsed.eventCount(),
                    Boolean.TRUE.equals(parsed.finalized()));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new RecordEncodingException("Invalid block record: " + e.getMessage(), e);
        }
    }

    private static <T> T required(final @Nullable T value, final String field) {
        if (value == null) {
            throw new IllegalArgumentException("missing required field '" + field + "'");
        }
        return value;
    }
}
