package io.coko.billing.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Instant;

@TestConfiguration
public class TestClockConfig {

	public static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

	@Bean
	@Primary
	public MutableClock mutableClock() {
		return new MutableClock(START);
	}
}
