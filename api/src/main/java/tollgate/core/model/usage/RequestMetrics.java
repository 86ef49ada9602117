package tollgate.core.model.usage;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * What the request path observed about one admitted request.
 *
 * <p>The optional fields are reported by business logic when it knows better
 * than the byte-based estimates (e.g. exact model token counts).
 *
 * @param usageId       the usage id issued with the admission decision
 * @param startedAt     when the request was admitted
 * @param duration      wall-clock time spent handling the request
 * @param requestBytes  request payload size
 * @param responseBytes response payload size
 * @param statusCode    final HTTP status
 * @param tokensIn      reported input tokens
 * @param tokensOut     reported output tokens
 * @param model         reported model name
 * @param storageBytes  reported stored bytes
 */
public record RequestMetrics(
        String usageId,
        Instant startedAt,
        Duration duration,
        long requestBytes,
        long responseBytes,
        int statusCode,
        OptionalLong tokensIn,
        OptionalLong tokensOut,
        Optional<String> model,
        OptionalLong storageBytes) {

    public RequestMetrics {
        if (usageId == null || usageId.isBlank()) {
            throw new IllegalArgumentException("Usage id cannot be null or blank");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("Start time cannot be null");
        }
        duration = duration != null && !duration.isNegative() ? duration : Duration.ZERO;
        requestBytes = Math.max(0, requestBytes);
        responseBytes = Math.max(0, responseBytes);
        tokensIn = tokensIn != null ? tokensIn : OptionalLong.empty();
        tokensOut = tokensOut != null ? tokensOut : OptionalLong.empty();
        model = model != null ? model : Optional.empty();
        storageBytes = storageBytes != null ? storageBytes : OptionalLong.empty();
    }

    public boolean success() {
        return statusCode < 400;
    }

    public static Builder builder(String usageId, Instant startedAt) {
        return new Builder(usageId, startedAt);
    }

    public static final class Builder {
        private final String usageId;
        private final Instant startedAt;
        private Duration duration = Duration.ZERO;
        private long requestBytes;
        private long responseBytes;
        private int statusCode = 200;
        private OptionalLong tokensIn = OptionalLong.empty();
        private OptionalLong tokensOut = OptionalLong.empty();
        private Optional<String> model = Optional.empty();
        private OptionalLong storageBytes = OptionalLong.empty();

        private Builder(String usageId, Instant startedAt) {
            this.usageId = usageId;
            this.startedAt = startedAt;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder requestBytes(long requestBytes) {
            this.requestBytes = requestBytes;
            return this;
        }

        public Builder responseBytes(long responseBytes) {
            this.responseBytes = responseBytes;
            return this;
        }

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder tokensIn(long tokensIn) {
            this.tokensIn = OptionalLong.of(tokensIn);
            return this;
        }

        public Builder tokensOut(long tokensOut) {
            this.tokensOut = OptionalLong.of(tokensOut);
            return this;
        }

        public Builder model(String model) {
            this.model = Optional.ofNullable(model);
            return this;
        }

        public Builder storageBytes(long storageBytes) {
            this.storageBytes = OptionalLong.of(storageBytes);
            return this;
        }

        public RequestMetrics build() {
            return new RequestMetrics(
                    usageId,
                    startedAt,
                    duration,
                    requestBytes,
                    responseBytes,
                    statusCode,
                    tokensIn,
                    tokensOut,
                    model,
                    storageBytes);
        }
    }
}
