package com.partner.match;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class PartnerMatchApplication {

	public static void main(String[] args) {
		SpringApplication.run(PartnerMatchApplication.class, args);
	}

}
