package com.di.loannova;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LoanNovaApplication {

	public static void main(String[] args) {
		SpringApplication.run(LoanNovaApplication.class, args);
	}
}
