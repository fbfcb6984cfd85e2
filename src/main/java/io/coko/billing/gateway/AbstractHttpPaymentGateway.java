package io.coko.billing.gateway;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.coko.billing.exception.ProviderException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.ledger.SubjectRef;
import io.coko.billing.metrics.BillingMetrics;
import io.coko.billing.money.CurrencyCode;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.Map;

/**
 * Shared HTTP plumbing for provider gateways.
 *
 * Error mapping:
 * - 5xx, 408, 429, timeouts and I/O errors: {@link ProviderException.Kind#TRANSIENT}
 * - any other non-2xx status is handed back to the gateway, which decides between a decline
 *   and a {@link ProviderException.Kind#PERMANENT} failure
 */
public abstract class AbstractHttpPaymentGateway implements PaymentGateway {

	protected final Logger log = LoggerFactory.getLogger(getClass());

	protected final ObjectMapper objectMapper;
	protected final BillingMetrics metrics;
	protected final Clock clock;
	private final RestTemplate restTemplate;

	protected AbstractHttpPaymentGateway(int timeoutMs, ObjectMapper objectMapper, BillingMetrics metrics, Clock clock) {
		this.objectMapper = objectMapper;
		this.metrics = metrics;
		this.clock = clock;
		this.restTemplate = createRestTemplate(timeoutMs);
	}

	private static RestTemplate createRestTemplate(int timeoutMs) {
		SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
		factory.setConnectTimeout(timeoutMs);
		factory.setReadTimeout(timeoutMs);
		RestTemplate rt = new RestTemplate(factory);
		// status codes are mapped by postJson
		rt.setErrorHandler(new ResponseErrorHandler() {
			@Override
			public boolean hasError(ClientHttpResponse response) {
				return false;
			}

			@Override
			public void handleError(ClientHttpResponse response) throws IOException {
				throw new IllegalStateException("Unexpected error handler call: " + response.getStatusCode());
			}
		});
		return rt;
	}

	/**
	 * Exposed so tests can bind a mock server to the gateway's client.
	 */
	public RestTemplate getRestTemplate() {
		return restTemplate;
	}

	/**
	 * POST a JSON body and return the response. Transient statuses and I/O errors are thrown as
	 * {@link ProviderException}; every other status is returned to the caller.
	 */
	protected ProviderResponse postJson(String callName, String url, HttpHeaders headers, Object body) {
		headers.setContentType(MediaType.APPLICATION_JSON);
		headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
		HttpEntity<Object> request = new HttpEntity<>(body, headers);

		log.info("{} {} REQ: url={}", provider(), callName, url);
		Timer.Sample sample = metrics.startTimer();
		ResponseEntity<String> response;
		try {
			response = restTemplate.exchange(url, HttpMethod.POST, request, String.class);
		} catch (ResourceAccessException e) {
			throw ProviderException.transientFailure(provider(), callName + " I/O failure: " + e.getMessage(), e);
		} catch (RestClientException e) {
			throw ProviderException.transientFailure(provider(), callName + " failed: " + e.getMessage(), e);
		} finally {
			metrics.recordProviderCall(provider().getCode(), sample);
		}

		int statusCode = response.getStatusCode().value();
		log.info("{} {} RESP: url={} statusCode={}", provider(), callName, url, statusCode);
		if (statusCode >= 500 || statusCode == 408 || statusCode == 429) {
			throw ProviderException.transientFailure(provider(),
				callName + " returned " + statusCode, null);
		}
		return new ProviderResponse(statusCode, parseBody(callName, statusCode, response.getBody()));
	}

	private Map<String, Object> parseBody(String callName, int statusCode, String body) {
		if (body == null || body.isBlank()) {
			return Collections.emptyMap();
		}
		try {
			return objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {});
		} catch (IOException e) {
			if (statusCode >= 200 && statusCode < 300) {
				// outcome unknown; resending with the same idempotency key is safe
				throw ProviderException.transientFailure(provider(), callName + " returned an unreadable body", e);
			}
			log.warn("{} {} returned a non-JSON error body: statusCode={}", provider(), callName, statusCode);
			return Collections.emptyMap();
		}
	}

	protected JsonNode readPayload(byte[] rawPayload) {
		if (rawPayload == null || rawPayload.length == 0) {
			throw new ValidationException("Empty webhook payload");
		}
		try {
			JsonNode node = objectMapper.readTree(rawPayload);
			if (node == null || !node.isObject()) {
				throw new ValidationException("Webhook payload is not a JSON object");
			}
			return node;
		} catch (IOException e) {
			throw new ValidationException("Malformed " + provider() + " webhook payload", e);
		}
	}

	protected static String text(JsonNode node, String field) {
		JsonNode value = node.get(field);
		if (value == null || value.isNull()) {
			return null;
		}
		String text = value.asText();
		return text.isBlank() ? null : text;
	}

	protected static String requireText(JsonNode node, String field) {
		String value = text(node, field);
		if (value == null) {
			throw new ValidationException("Webhook payload is missing '" + field + "'", field, null);
		}
		return value;
	}

	protected static CurrencyCode requireCurrency(JsonNode node, String field) {
		String code = requireText(node, field);
		CurrencyCode currency = CurrencyCode.fromCode(code);
		if (currency == null) {
			throw new ValidationException("Unknown currency in webhook payload: " + code, field, code);
		}
		return currency;
	}

	protected static SubjectRef optionalSubject(String reference) {
		return reference != null ? SubjectRef.parse(reference) : null;
	}

	protected static String bodyText(Map<String, Object> body, String field) {
		Object value = body.get(field);
		return value != null ? String.valueOf(value) : null;
	}

	protected static final class ProviderResponse {

		private final int statusCode;
		private final Map<String, Object> body;

		ProviderResponse(int statusCode, Map<String, Object> body) {
			this.statusCode = statusCode;
			this.body = body;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public Map<String, Object> getBody() {
			return body;
		}

		public boolean isSuccessful() {
			return statusCode >= 200 && statusCode < 300;
		}
	}
}
