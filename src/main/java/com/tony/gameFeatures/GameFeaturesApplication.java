package com.tony.gameFeatures;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GameFeaturesApplication {

	public static void main(String[] args) {
		SpringApplication.run(GameFeaturesApplication.class, args);
	}

}
