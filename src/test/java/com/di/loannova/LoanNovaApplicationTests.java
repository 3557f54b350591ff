package com.di.loannova;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test for LoanNovaApplication without starting a Spring context.
 */
@DisplayName("LoanNovaApplication Tests")
class LoanNovaApplicationTests {

	@Test
	@DisplayName("Should be a Spring Boot application scanning configuration properties")
	void testApplicationAnnotations() {
		assertTrue(LoanNovaApplication.class.isAnnotationPresent(SpringBootApplication.class));
		assertTrue(LoanNovaApplication.class.isAnnotationPresent(ConfigurationPropertiesScan.class));
	}

	@Test
	@DisplayName("Should have a public static main method")
	void testMainMethodExists() throws NoSuchMethodException {
		Method mainMethod = LoanNovaApplication.class.getMethod("main", String[].class);
		assertTrue(Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(Modifier.isPublic(mainMethod.getModifiers()));
	}
}
