package com.pubsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author 席崇援
 * @since 2025-11-02
 */
@SpringBootApplication
public class PubSyncApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(PubSyncApplication.class, args)));
	}

}
