package com.prediction.market.lmsr_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LmsrMarketApplication {

	public static void main(String[] args) {
		SpringApplication.run(LmsrMarketApplication.class, args);
	}

}
