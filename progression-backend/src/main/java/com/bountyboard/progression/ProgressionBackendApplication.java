package com.bountyboard.progression;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // 看板徽章文档定时刷新
public class ProgressionBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProgressionBackendApplication.class, args);
    }
}
