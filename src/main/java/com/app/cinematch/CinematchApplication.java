package com.app.cinematch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CinematchApplication {

	public static void main(String[] args) {
		SpringApplication.run(CinematchApplication.class, args);
	}

}
