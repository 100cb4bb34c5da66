package com.di.eventreplay;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test for EventReplayApplication without starting a context, which would
 * need a reachable PostgreSQL.
 */
@DisplayName("EventReplayApplication Tests")
class EventReplayApplicationTests {

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = EventReplayApplication.class.getMethod("main", String[].class);
		assertNotNull(mainMethod);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}

	@Test
	@DisplayName("Should exclude DataSource auto-configuration")
	void testDataSourceAutoConfigurationExcluded() {
		SpringBootApplication annotation = EventReplayApplication.class.getAnnotation(SpringBootApplication.class);
		assertNotNull(annotation);
		assertTrue(List.of(annotation.exclude()).contains(DataSourceAutoConfiguration.class));
	}

}
