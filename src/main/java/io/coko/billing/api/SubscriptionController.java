package io.coko.billing.api;

import io.coko.billing.api.dto.CreateSubscriptionRequest;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import io.coko.billing.subscription.BillingFrequency;
import io.coko.billing.subscription.RecurringBillingOrchestrator;
import io.coko.billing.subscription.Subscription;
import io.coko.billing.subscription.SubscriptionRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Subscription lifecycle. Renewals themselves are driven by the scheduler or the billing run endpoint.
 */
@RestController
@RequestMapping("/api/subscriptions")
public class SubscriptionController {

	private final RecurringBillingOrchestrator orchestrator;

	public SubscriptionController(RecurringBillingOrchestrator orchestrator) {
		this.orchestrator = orchestrator;
	}

	@PostMapping
	public ResponseEntity<Map<String, Object>> create(@RequestBody CreateSubscriptionRequest body) {
		CurrencyCode currency = ApiRequests.currency(body.getCurrency());
		if (body.getPriceMinor() == null) {
			throw new ValidationException("priceMinor is required", "priceMinor", null);
		}
		BillingFrequency frequency = BillingFrequency.fromCode(body.getFrequency());
		if (frequency == null) {
			throw new ValidationException("Unknown billing frequency: " + body.getFrequency(), "frequency", body.getFrequency());
		}

		SubscriptionRequest request = new SubscriptionRequest();
		request.setUserRef(body.getUserRef());
		request.setPlanCode(body.getPlanCode());
		request.setPrice(Money.ofMinor(body.getPriceMinor(), currency));
		request.setFrequency(frequency);
		request.setProvider(ApiRequests.provider(body.getProvider()));
		request.setPaymentMethodRef(body.getPaymentMethodRef());
		request.setStartAt(body.getStartAt());
		request.setTotalCycles(body.getTotalCycles());

		Subscription subscription = orchestrator.createSubscription(request);
		return ResponseEntity.status(HttpStatus.CREATED).body(ApiViews.subscription(subscription));
	}

	@GetMapping("/{subscriptionId}")
	public ResponseEntity<Map<String, Object>> get(@PathVariable String subscriptionId) {
		UUID id = ApiRequests.uuid(subscriptionId, "subscriptionId");
		Map<String, Object> view = ApiViews.subscription(orchestrator.getSubscription(id));
		List<Map<String, Object>> attempts = new ArrayList<>();
		orchestrator.getChargeAttempts(id).forEach(a -> attempts.add(ApiViews.chargeAttempt(a)));
		view.put("chargeAttempts", attempts);
		return ResponseEntity.ok(view);
	}

	@PostMapping("/{subscriptionId}/pause")
	public ResponseEntity<Map<String, Object>> pause(@PathVariable String subscriptionId) {
		Subscription s = orchestrator.pauseSubscription(ApiRequests.uuid(subscriptionId, "subscriptionId"));
		return ResponseEntity.ok(ApiViews.subscription(s));
	}

	@PostMapping("/{subscriptionId}/resume")
	public ResponseEntity<Map<String, Object>> resume(@PathVariable String subscriptionId) {
		Subscription s = orchestrator.resumeSubscription(ApiRequests.uuid(subscriptionId, "subscriptionId"));
		return ResponseEntity.ok(ApiViews.subscription(s));
	}

	@PostMapping("/{subscriptionId}/cancel")
	public ResponseEntity<Map<String, Object>> cancel(@PathVariable String subscriptionId) {
		Subscription s = orchestrator.cancelSubscription(ApiRequests.uuid(subscriptionId, "subscriptionId"));
		return ResponseEntity.ok(ApiViews.subscription(s));
	}
}
