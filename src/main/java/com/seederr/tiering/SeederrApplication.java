package com.seederr.tiering;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Seederr 分层放置服务启动类
 * 
 * 按热度把种子内容在 SSD 缓存盘与主存储阵列之间调度，
 * 主存储副本永不删除，缓存副本只是可丢弃的复制品。
 */
@SpringBootApplication
public class SeederrApplication {

    public static void main(String[] args) {
        SpringApplication.run(SeederrApplication.class, args);
    }
}
