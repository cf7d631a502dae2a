package com.tokenpool.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ✅ Token pool backend
 * - 沒有 @EnableScheduling：cooldown 到期一律在選 token 時比對時間（lazy），不靠排程
 */
@SpringBootApplication
public class BackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
