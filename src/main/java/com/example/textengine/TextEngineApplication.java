package com.example.textengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Application entry point for the text extraction engine.
 * Only wires the application context; the engine itself is assembled in
 * {@link com.example.textengine.infrastructure.config.ExtractionConfig}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TextEngineApplication {

	/**
	 * Boots the Spring container and exposes the HTTP endpoints defined under the interfaces layer.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(TextEngineApplication.class, args);
	}

}
