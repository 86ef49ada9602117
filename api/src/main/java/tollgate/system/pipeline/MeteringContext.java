package tollgate.system.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.MultivaluedMap;

import tollgate.core.model.ratelimit.AdmissionDecision;
import tollgate.core.model.usage.UsageRecord;

/**
 * Per-request state shared by the metering stages.
 *
 * <p>Created by the request filter and carried to the response filter as a
 * request property. Request-side fields are fixed at creation. Response-side
 * fields are filled in by the response filter before {@code onResponse} runs.
 */
public final class MeteringContext {

    private final String identity;
    private final String tierValue;
    private final String category;
    private final String path;
    private final Instant startedAt;
    private final long startNanos;
    private final long requestBytes;
    private final List<MeteringStage> ranStages = new ArrayList<>();

    private AdmissionDecision decision;
    private UsageRecord usageRecord;

    private int statusCode = 200;
    private long responseBytes;
    private Duration duration = Duration.ZERO;
    private MultivaluedMap<String, Object> responseHeaders = new MultivaluedHashMap<>();
    private OptionalLong reportedTokensIn = OptionalLong.empty();
    private OptionalLong reportedTokensOut = OptionalLong.empty();
    private Optional<String> reportedModel = Optional.empty();
    private OptionalLong reportedStorageBytes = OptionalLong.empty();

    public MeteringContext(
            String identity, String tierValue, String category, String path, Instant startedAt, long requestBytes) {
        this.identity = identity;
        this.tierValue = tierValue;
        this.category = category;
        this.path = path;
        this.startedAt = startedAt;
        this.startNanos = System.nanoTime();
        this.requestBytes = Math.max(0, requestBytes);
    }

    public String identity() {
        return identity;
    }

    /**
     * Tier value as presented by the caller, may be null or unknown.
     */
    public String tierValue() {
        return tierValue;
    }

    public String category() {
        return category;
    }

    public String path() {
        return path;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public long requestBytes() {
        return requestBytes;
    }

    public Optional<AdmissionDecision> decision() {
        return Optional.ofNullable(decision);
    }

    public void decision(AdmissionDecision decision) {
        this.decision = decision;
    }

    public Optional<UsageRecord> usageRecord() {
        return Optional.ofNullable(usageRecord);
    }

    public void usageRecord(UsageRecord usageRecord) {
        this.usageRecord = usageRecord;
    }

    // ========== Response side ==========

    /**
     * Record what the response filter observed. Elapsed time is measured from
     * context creation.
     */
    public void completed(int statusCode, long responseBytes, MultivaluedMap<String, Object> responseHeaders) {
        this.statusCode = statusCode;
        this.responseBytes = Math.max(0, responseBytes);
        this.duration = Duration.ofNanos(System.nanoTime() - startNanos);
        this.responseHeaders = responseHeaders;
    }

    public int statusCode() {
        return statusCode;
    }

    public long responseBytes() {
        return responseBytes;
    }

    public Duration duration() {
        return duration;
    }

    /**
     * Live response headers. Stages add their headers here.
     */
    public MultivaluedMap<String, Object> responseHeaders() {
        return responseHeaders;
    }

    public OptionalLong reportedTokensIn() {
        return reportedTokensIn;
    }

    public void reportedTokensIn(long tokensIn) {
        this.reportedTokensIn = OptionalLong.of(tokensIn);
    }

    public OptionalLong reportedTokensOut() {
        return reportedTokensOut;
    }

    public void reportedTokensOut(long tokensOut) {
        this.reportedTokensOut = OptionalLong.of(tokensOut);
    }

    public Optional<String> reportedModel() {
        return reportedModel;
    }

    public void reportedModel(String model) {
        this.reportedModel = Optional.ofNullable(model);
    }

    public OptionalLong reportedStorageBytes() {
        return reportedStorageBytes;
    }

    public void reportedStorageBytes(long storageBytes) {
        this.reportedStorageBytes = OptionalLong.of(storageBytes);
    }

    // ========== Pipeline bookkeeping ==========

    void markRan(MeteringStage stage) {
        ranStages.add(stage);
    }

    /**
     * Stages whose {@code onRequest} ran, in the order they ran.
     */
    List<MeteringStage> ranStages() {
        return List.copyOf(ranStages);
    }
}
