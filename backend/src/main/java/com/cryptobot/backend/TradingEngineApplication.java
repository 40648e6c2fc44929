package com.cryptobot.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradingEngineApplication {
	public static void main(String[] args) {
		SpringApplication.run(TradingEngineApplication.class, args);
	}
}
