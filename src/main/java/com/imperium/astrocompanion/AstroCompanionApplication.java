package com.imperium.astrocompanion;

import com.imperium.astrocompanion.config.DotenvLoader;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@MapperScan("com.imperium.astrocompanion.mapper")
public class AstroCompanionApplication {

    public static void main(String[] args) {
        DotenvLoader.load(); // .env -> 系统属性，供 application.yaml 中的 ${VAR} 使用
        SpringApplication.run(AstroCompanionApplication.class, args);
    }
}
