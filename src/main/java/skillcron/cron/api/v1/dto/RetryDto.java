package skillcron.cron.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import skillcron.cron.model.RetryPolicy;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetryDto(
        @JsonProperty("maxRetries") Integer maxRetries,
        @JsonProperty("backoffMs") Long backoffMs) {

    public RetryPolicy toPolicy() {
        return RetryPolicy.of(
                maxRetries != null ? maxRetries : 0,
                backoffMs != null ? backoffMs : RetryPolicy.DEFAULT_BACKOFF_MS);
    }

    public static RetryDto from(RetryPolicy policy) {
        return new RetryDto(policy.maxRetries(), policy.backoffMs());
    }
}
