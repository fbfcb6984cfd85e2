package io.coko.billing.api.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * One-off invoice. Unit prices are in minor units of {@code currency}.
 */
public class CreateInvoiceRequest {

	private String userRef;
	private String currency;
	private String billingEntity;
	private Long discountMinor;
	private List<InvoiceItemRequest> items = new ArrayList<>();

	public String getUserRef() {
		return userRef;
	}

	public void setUserRef(String userRef) {
		this.userRef = userRef;
	}

	public String getCurrency() {
		return currency;
	}

	public void setCurrency(String currency) {
		this.currency = currency;
	}

	public String getBillingEntity() {
		return billingEntity;
	}

	public void setBillingEntity(String billingEntity) {
		this.billingEntity = billingEntity;
	}

	public Long getDiscountMinor() {
		return discountMinor;
	}

	public void setDiscountMinor(Long discountMinor) {
		this.discountMinor = discountMinor;
	}

	public List<InvoiceItemRequest> getItems() {
		return items;
	}

	public void setItems(List<InvoiceItemRequest> items) {
		this.items = items;
	}
}
