package io.coko.billing.batch.model;

import java.util.UUID;

/**
 * Subscription picked up by the renewal reader.
 */
public class DueSubscriptionRow {
	private UUID subscriptionId;
	private String userRef;
	private String status;
	private long version;

	public UUID getSubscriptionId() {
		return subscriptionId;
	}

	public void setSubscriptionId(UUID subscriptionId) {
		this.subscriptionId = subscriptionId;
	}

	public String getUserRef() {
		return userRef;
	}

	public void setUserRef(String userRef) {
		this.userRef = userRef;
	}

	public String getStatus() {
		return status;
	}

	public void setStatus(String status) {
		this.status = status;
	}

	public long getVersion() {
		return version;
	}

	public void setVersion(long version) {
		this.version = version;
	}
}
