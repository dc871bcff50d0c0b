package com.sandy.aiot.vision.sentinel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class AiotVisionSentinelApplication {

	public static void main(String[] args) {
		SpringApplication.run(AiotVisionSentinelApplication.class, args);
	}

}
