package io.coko.billing.api.dto;

public class InvoiceItemRequest {

	private String description;
	private Integer quantity;
	private Long unitPriceMinor;
	private String itemType;
	private String authorRef;

	public String getDescription() {
		return description;
	}

	public void setDescription(String description) {
		this.description = description;
	}

	public Integer getQuantity() {
		return quantity;
	}

	public void setQuantity(Integer quantity) {
		this.quantity = quantity;
	}

	public Long getUnitPriceMinor() {
		return unitPriceMinor;
	}

	public void setUnitPriceMinor(Long unitPriceMinor) {
		this.unitPriceMinor = unitPriceMinor;
	}

	public String getItemType() {
		return itemType;
	}

	public void setItemType(String itemType) {
		this.itemType = itemType;
	}

	public String getAuthorRef() {
		return authorRef;
	}

	public void setAuthorRef(String authorRef) {
		this.authorRef = authorRef;
	}
}
