package com.cine.explorer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CineExplorerApplication {

	public static void main(String[] args) {
		SpringApplication.run(CineExplorerApplication.class, args);
	}

}
