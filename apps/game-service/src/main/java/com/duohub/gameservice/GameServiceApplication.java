package com.duohub.gameservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * game-service 启动入口。
 * 通过 @EnableFeignClients 启用权威后端与积分账本的 Feign Client。
 */
@SpringBootApplication
@EnableFeignClients
public class GameServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameServiceApplication.class, args);
    }
}
