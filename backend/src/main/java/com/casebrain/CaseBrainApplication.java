package com.casebrain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CaseBrain - housing disrepair hazard assessment service.
 */
@SpringBootApplication
public class CaseBrainApplication {

	public static void main(String[] args) {
		SpringApplication.run(CaseBrainApplication.class, args);
	}

}
