package com.ai.group.Charactle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CharactleApplication {
	public static void main(String[] args) {
		SpringApplication.run(CharactleApplication.class, args);
	}
}
