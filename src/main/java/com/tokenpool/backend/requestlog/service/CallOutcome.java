package com.tokenpool.backend.requestlog.service;

import com.tokenpool.backend.usage.UsageCounts;

/**
 * proxy 打完 upstream 後交給 {@link RequestLogService#append} 的結果。
 *
 * @param token 原文；寫入前會被截成尾碼
 * @param usage null = 沒有用量（例如請求根本沒送出去）
 * @param error null / blank = 成功
 */
public record CallOutcome(
        String ip,
        String model,
        double durationSec,
        int status,
        String keyName,
        String token,
        UsageCounts usage,
        String error
) {}
