package io.coko.billing.api;

import io.coko.billing.exception.ValidationException;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.money.CurrencyCode;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Request parameter parsing. Every failure surfaces as validation_failed.
 */
final class ApiRequests {

	private ApiRequests() {
	}

	static UUID uuid(String value, String field) {
		try {
			return UUID.fromString(value);
		} catch (IllegalArgumentException | NullPointerException e) {
			throw new ValidationException("Invalid " + field, field, value);
		}
	}

	static CurrencyCode currency(String code) {
		CurrencyCode currency = CurrencyCode.fromCode(code);
		if (currency == null) {
			throw new ValidationException("Unsupported currency: " + code, "currency", code);
		}
		return currency;
	}

	static PaymentProvider provider(String code) {
		PaymentProvider provider = PaymentProvider.fromCode(code);
		if (provider == null) {
			throw new ValidationException("Unknown payment provider: " + code, "provider", code);
		}
		return provider;
	}

	static Instant instant(String value, String field) {
		try {
			return Instant.parse(value.trim());
		} catch (DateTimeParseException | NullPointerException e) {
			throw new ValidationException("Invalid " + field + ". Use ISO-8601 instant format.", field, value);
		}
	}

	static LocalDate date(String value, String field) {
		try {
			return LocalDate.parse(value.trim());
		} catch (DateTimeParseException | NullPointerException e) {
			throw new ValidationException("Invalid " + field + ". Use ISO date format (yyyy-MM-dd).", field, value);
		}
	}

	static String required(String value, String field) {
		if (value == null || value.isBlank()) {
			throw new ValidationException(field + " is required", field, value);
		}
		return value.trim();
	}

	/**
	 * Name of the authenticated caller, or "api-user" when security is disabled.
	 */
	static String actor() {
		Authentication auth = SecurityContextHolder.getContext().getAuthentication();
		if (auth == null || auth instanceof AnonymousAuthenticationToken || auth.getName() == null) {
			return "api-user";
		}
		return auth.getName();
	}
}
