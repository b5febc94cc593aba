package com.liquidity.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LiquidityBackendApplication {
	public static void main(String[] args) {
		SpringApplication.run(LiquidityBackendApplication.class, args);
	}
}
