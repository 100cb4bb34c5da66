package com.di.eventreplay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class EventReplayApplication {

	public static void main(String[] args) {
		try {
			SpringApplication.run(EventReplayApplication.class, args);
		} catch (Exception e) {
			// already logged by the runner / Spring Boot
			System.exit(1);
		}
	}
}
