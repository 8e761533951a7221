package com.kernos.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kernos.kernel.KernelEvent;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * One ledger line: a {@link KernelEvent} flattened to strings.
 * Null keycode, entry point and previous address are omitted from JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LedgerRecord {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final long sequence;
    private final long timestampMillis;
    private final String kernel;
    private final String type;
    private final String action;
    private final String subject;
    private final String keycode;
    private final String entryPoint;
    private final String previous;

    @JsonCreator
    public LedgerRecord(
            @JsonProperty("sequence") long sequence,
            @JsonProperty("timestampMillis") long timestampMillis,
            @JsonProperty("kernel") String kernel,
            @JsonProperty("type") String type,
            @JsonProperty("action") String action,
            @JsonProperty("subject") String subject,
            @JsonProperty("keycode") String keycode,
            @JsonProperty("entryPoint") String entryPoint,
            @JsonProperty("previous") String previous) {
        this.sequence = sequence;
        this.timestampMillis = timestampMillis;
        this.kernel = kernel;
        this.type = type;
        this.action = action;
        this.subject = subject;
        this.keycode = keycode;
        this.entryPoint = entryPoint;
        this.previous = previous;
    }

    public static LedgerRecord from(KernelEvent event) {
        return new LedgerRecord(
                event.sequence(),
                event.timestampMillis(),
                asString(event.kernel()),
                asString(event.type()),
                asString(event.action()),
                asString(event.subject()),
                asString(event.keycode()),
                event.entryPoint(),
                asString(event.previous()));
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    public static LedgerRecord fromJson(String json) {
        try {
            return MAPPER.readValue(json, LedgerRecord.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public long getSequence() {
        return sequence;
    }

    public long getTimestampMillis() {
        return timestampMillis;
    }

    public String getKernel() {
        return kernel;
    }

    public String getType() {
        return type;
    }

    public String getAction() {
        return action;
    }

    public String getSubject() {
        return subject;
    }

    public String getKeycode() {
        return keycode;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public String getPrevious() {
        return previous;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LedgerRecord that = (LedgerRecord) o;
        return sequence == that.sequence
                && timestampMillis == that.timestampMillis
                && Objects.equals(kernel, that.kernel)
                && Objects.equals(type, that.type)
                && Objects.equals(action, that.action)
                && Objects.equals(subject, that.subject)
                && Objects.equals(keycode, that.keycode)
                && Objects.equals(entryPoint, that.entryPoint)
                && Objects.equals(previous, that.previous);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, timestampMillis, kernel, type, action, subject, keycode, entryPoint, previous);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
