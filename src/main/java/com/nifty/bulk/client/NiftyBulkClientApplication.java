package com.nifty.bulk.client;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NiftyBulkClientApplication {

	public static void main(String[] args) {
		SpringApplication.run(NiftyBulkClientApplication.class, args);
	}

}
