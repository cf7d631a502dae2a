package com.tokenpool.backend.token.config;

import com.tokenpool.backend.token.model.WorkloadClass;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "app.token-pool")
public class TokenPoolProperties {

    /** 失敗次數到這個值：selection 先跳過；若是 4xx 就直接 EXPIRED */
    private int failureLimit = 3;

    /** 走 heavy 額度的 model id */
    private List<String> heavyModels = new ArrayList<>(List.of("grok-4-heavy"));

    private Cooldown cooldown = new Cooldown();

    /** admin 列表預設每頁筆數 */
    private int defaultPerPage = 30;

    /** request log 預設取幾筆 */
    private int requestLogLimit = 1000;

    @Data
    public static class Cooldown {

        /** 429 且還有額度（或還沒用過） */
        private Duration rateLimited = Duration.ofHours(1);

        /** 429 且額度已經是 0：休息 10 倍 */
        private Duration rateLimitedExhausted = Duration.ofHours(10);

        /** 其他錯誤：短暫退避（用時間近似「隔幾次請求再試」） */
        private Duration transientError = Duration.ofSeconds(30);
    }

    public WorkloadClass workloadOf(String model) {
        return WorkloadClass.fromModel(model, heavyModels);
    }
}
