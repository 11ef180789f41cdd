package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TimeFrameUnit {
    @JsonProperty("hours")
    HOURS,
    @JsonProperty("days")
    DAYS,
    @JsonProperty("weeks")
    WEEKS,
    @JsonProperty("months")
    MONTHS
}
