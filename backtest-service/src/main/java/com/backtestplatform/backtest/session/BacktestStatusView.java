package com.backtestplatform.backtest.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BacktestStatusView(
    @JsonProperty("backtest_id")     String backtestId,
    @JsonProperty("status")          BacktestStatus status,
    @JsonProperty("progress")        double progress,
    @JsonProperty("current_date")    LocalDate currentDate,
    @JsonProperty("is_running")      boolean isRunning,
    @JsonProperty("error_message")   String errorMessage,
    @JsonProperty("start_time")      Instant startTime,
    @JsonProperty("completion_time") Instant completionTime,
    @JsonProperty("warnings")        List<String> warnings,
    @JsonProperty("request_summary") Map<String, Object> requestSummary
) {}
