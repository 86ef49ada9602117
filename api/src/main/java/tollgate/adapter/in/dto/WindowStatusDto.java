package tollgate.adapter.in.dto;

import tollgate.core.model.ratelimit.WindowStatus;

/**
 * DTO for one rate limit window. Unlimited windows report null limit and remaining.
 */
public record WindowStatusDto(String window, Long limit, long count, Long remaining, long resetSeconds, boolean exceeded) {

    public static WindowStatusDto fromModel(WindowStatus status) {
        return new WindowStatusDto(
                status.kind().value(),
                status.unlimited() ? null : status.limit(),
                status.count(),
                status.unlimited() ? null : status.remaining(),
                status.resetSeconds(),
                status.exceeded());
    }
}
