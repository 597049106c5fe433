package com.railwise.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RailwiseApplication {

	public static void main(String[] args) {
		SpringApplication.run(RailwiseApplication.class, args);
	}

}
