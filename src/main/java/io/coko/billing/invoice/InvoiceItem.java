package io.coko.billing.invoice;

import io.coko.billing.money.Money;

public class InvoiceItem {

	private final String description;
	private final int quantity;
	private final Money unitPrice;
	private final ItemType itemType;
	private final String authorRef;

	public InvoiceItem(String description, int quantity, Money unitPrice, ItemType itemType) {
		this(description, quantity, unitPrice, itemType, null);
	}

	public InvoiceItem(String description, int quantity, Money unitPrice, ItemType itemType, String authorRef) {
		this.description = description;
		this.quantity = quantity;
		this.unitPrice = unitPrice;
		this.itemType = itemType;
		this.authorRef = authorRef;
	}

	public String getDescription() {
		return description;
	}

	public int getQuantity() {
		return quantity;
	}

	public Money getUnitPrice() {
		return unitPrice;
	}

	public ItemType getItemType() {
		return itemType;
	}

	public String getAuthorRef() {
		return authorRef;
	}

	public Money getLineTotal() {
		return unitPrice.times(quantity);
	}
}
