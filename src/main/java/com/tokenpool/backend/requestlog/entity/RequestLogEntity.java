package com.tokenpool.backend.requestlog.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 每次 proxy 呼叫一筆。只存 token 尾碼，不存原文。
 */
@Getter
@Setter
@Entity
@Table(
        name = "request_logs",
        indexes = @Index(name = "idx_request_logs_created", columnList = "created_at_utc")
)
public class RequestLogEntity {

    @Id
    @Column(name = "id", length = 36, nullable = false)
    private String id;

    @Column(name = "created_at_utc", nullable = false, updatable = false)
    private Instant createdAtUtc;

    /** 顯示用（yyyy-MM-dd HH:mm:ss, UTC） */
    @Column(name = "time_text", length = 32, nullable = false)
    private String time;

    @Column(name = "ip", length = 64)
    private String ip;

    @Column(name = "model", length = 128)
    private String model;

    @Column(name = "duration_sec", nullable = false)
    private double durationSec;

    @Column(name = "http_status", nullable = false)
    private int status;

    @Column(name = "key_name", length = 128)
    private String keyName;

    @Column(name = "token_suffix", length = 16)
    private String tokenSuffix;

    @Column(name = "total_tokens", nullable = false)
    private int totalTokens;

    @Column(name = "input_tokens", nullable = false)
    private int inputTokens;

    @Column(name = "output_tokens", nullable = false)
    private int outputTokens;

    @Column(name = "reasoning_tokens", nullable = false)
    private int reasoningTokens;

    @Column(name = "cached_tokens", nullable = false)
    private int cachedTokens;

    @Column(name = "error", length = 512)
    private String error;
}
