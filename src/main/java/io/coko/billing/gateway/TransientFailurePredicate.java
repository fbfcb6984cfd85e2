package io.coko.billing.gateway;

import io.coko.billing.exception.ProviderException;

import java.util.function.Predicate;

/**
 * Circuit breakers count only provider outages. A card decline says nothing about the
 * provider's health and must not open the circuit.
 */
public class TransientFailurePredicate implements Predicate<Throwable> {

	@Override
	public boolean test(Throwable throwable) {
		return throwable instanceof ProviderException && ((ProviderException) throwable).isTransient();
	}
}
