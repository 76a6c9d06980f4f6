package com.backoffice.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BackofficeLedgerApplication {

	public static void main(String[] args) {
		SpringApplication.run(BackofficeLedgerApplication.class, args);
	}

}
