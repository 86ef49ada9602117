package tollgate.adapter.in.dto;

import java.util.List;

import tollgate.core.model.ratelimit.RateLimitStatus;

/**
 * DTO for an identity's current rate limit windows.
 */
public record RateLimitStatusDto(String identity, String tier, List<WindowStatusDto> windows, boolean degraded) {

    public static RateLimitStatusDto fromModel(RateLimitStatus status) {
        return new RateLimitStatusDto(
                status.identity(),
                status.tier().value(),
                status.windows().stream().map(WindowStatusDto::fromModel).toList(),
                status.degraded());
    }
}
