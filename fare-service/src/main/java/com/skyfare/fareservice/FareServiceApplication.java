package com.skyfare.fareservice;

import com.skyfare.fareservice.config.AmadeusProperties;
import com.skyfare.fareservice.config.ComparisonProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = {"com.skyfare.fareservice", "com.skyfare.common"})
@EnableConfigurationProperties({AmadeusProperties.class, ComparisonProperties.class})
public class FareServiceApplication {
	
	public static void main(String[] args) {
		SpringApplication.run(FareServiceApplication.class, args);
	}
}
