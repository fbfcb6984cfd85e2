package io.coko.billing.api;

import io.coko.billing.api.dto.ErrorResponse;
import io.coko.billing.configstore.ConfigType;
import io.coko.billing.exception.BillingException;
import io.coko.billing.exception.ConfigMissingException;
import io.coko.billing.exception.CurrencyMismatchException;
import io.coko.billing.exception.InvalidStateTransitionException;
import io.coko.billing.exception.NotFoundException;
import io.coko.billing.exception.ProviderException;
import io.coko.billing.exception.UnauthenticatedWebhookException;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.money.CurrencyCode;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionHandlerTest {

	private final ApiExceptionHandler handler =
		new ApiExceptionHandler(Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));
	private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/invoices");

	@Test
	void statusFor_mapsEveryErrorCode() {
		assertThat(ApiExceptionHandler.statusFor("validation_failed")).isEqualTo(HttpStatus.BAD_REQUEST);
		assertThat(ApiExceptionHandler.statusFor("unauthenticated")).isEqualTo(HttpStatus.UNAUTHORIZED);
		assertThat(ApiExceptionHandler.statusFor("payment_failed")).isEqualTo(HttpStatus.PAYMENT_REQUIRED);
		assertThat(ApiExceptionHandler.statusFor("not_found")).isEqualTo(HttpStatus.NOT_FOUND);
		assertThat(ApiExceptionHandler.statusFor("conflict")).isEqualTo(HttpStatus.CONFLICT);
		assertThat(ApiExceptionHandler.statusFor("rate_limited")).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
		assertThat(ApiExceptionHandler.statusFor("unavailable")).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
		assertThat(ApiExceptionHandler.statusFor("configuration_missing")).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
		assertThat(ApiExceptionHandler.statusFor("something_else")).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
		assertThat(ApiExceptionHandler.statusFor(null)).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
	}

	@Test
	void currencyMismatch_isValidationFailureWithField() {
		ResponseEntity<ErrorResponse> response =
			handler.handleValidation(new CurrencyMismatchException(CurrencyCode.EUR, CurrencyCode.XOF), request);

		assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
		assertThat(response.getBody().getError()).isEqualTo("validation_failed");
		assertThat(response.getBody().getDetails()).containsEntry("field", "currency");
		assertThat(response.getBody().getPath()).isEqualTo("/api/invoices");
	}

	@Test
	void domainExceptions_mapThroughTheirErrorCode() {
		assertThat(handler.handleBilling(new NotFoundException("invoice", UUID.randomUUID()), request).getStatusCode())
			.isEqualTo(HttpStatus.NOT_FOUND);
		assertThat(handler.handleBilling(new InvalidStateTransitionException("invoice", "PAID", "VOID"), request)
			.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
		assertThat(handler.handleBilling(new UnauthenticatedWebhookException(PaymentProvider.CARD, "bad"), request)
			.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
		assertThat(handler.handleBilling(new BillingException("rate_limited", "slow down"), request).getStatusCode())
			.isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
	}

	@Test
	void configMissing_isServiceUnavailable() {
		ResponseEntity<ErrorResponse> response = handler.handleConfigMissing(
			new ConfigMissingException(ConfigType.PAYOUT_THRESHOLD, "XAF", Instant.parse("2025-01-01T00:00:00Z")), request);

		assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
		assertThat(response.getBody().getDetails()).containsEntry("key", "XAF");
	}

	@Test
	void provider_transientIsUnavailable_permanentIsPaymentRequired() {
		ResponseEntity<ErrorResponse> transientFailure = handler.handleProvider(
			ProviderException.transientFailure(PaymentProvider.MTN_MOMO, "timeout", null), request);
		ResponseEntity<ErrorResponse> declined = handler.handleProvider(
			ProviderException.permanentFailure(PaymentProvider.CARD, "insufficient_funds", "declined"), request);

		assertThat(transientFailure.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
		assertThat(transientFailure.getBody().getError()).isEqualTo("unavailable");
		assertThat(declined.getStatusCode()).isEqualTo(HttpStatus.PAYMENT_REQUIRED);
		assertThat(declined.getBody().getDetails()).containsEntry("providerCode", "insufficient_funds");
	}

	@Test
	void dataAccessAndUnexpected_doNotLeakMessages() {
		ResponseEntity<ErrorResponse> db = handler.handleDataAccess(
			new DataAccessResourceFailureException("connection refused to 10.0.0.5"), request);
		ResponseEntity<ErrorResponse> npe = handler.handleGeneric(new NullPointerException("secret"), request);

		assertThat(db.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
		assertThat(db.getBody().getMessage()).doesNotContain("10.0.0.5");
		assertThat(npe.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
		assertThat(npe.getBody().getMessage()).doesNotContain("secret");
	}
}
