package com.baykanat.ephemeral;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Uygulama giriş noktası; @EnableScheduling ile kanal TTL yenileme ve registry temizliği. */
@SpringBootApplication
@EnableScheduling
public class EphemeralApplication {

	public static void main(String[] args) {
		SpringApplication.run(EphemeralApplication.class, args);
	}

}
