package io.coko.billing.gateway;

import io.coko.billing.exception.ValidationException;
import io.coko.billing.ledger.PaymentProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class PaymentGatewayRegistry {

	private final Map<PaymentProvider, PaymentGateway> gateways = new EnumMap<>(PaymentProvider.class);

	public PaymentGatewayRegistry(List<PaymentGateway> gatewayBeans) {
		for (PaymentGateway gateway : gatewayBeans) {
			gateways.put(gateway.provider(), gateway);
		}
	}

	public PaymentGateway get(PaymentProvider provider) {
		PaymentGateway gateway = gateways.get(provider);
		if (gateway == null) {
			throw new ValidationException("No gateway configured for provider " + provider, "provider", provider);
		}
		return gateway;
	}
}
