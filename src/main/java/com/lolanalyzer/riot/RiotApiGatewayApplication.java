package com.lolanalyzer.riot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RiotApiGatewayApplication {

	public static void main(String[] args) {
		SpringApplication.run(RiotApiGatewayApplication.class, args);
	}
}
