package com.tony.propsAnalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PropsAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(PropsAnalyticsApplication.class, args);
	}

}
