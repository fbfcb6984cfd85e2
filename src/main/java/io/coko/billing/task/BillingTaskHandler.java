package io.coko.billing.task;

/**
 * Handler for one {@link TaskType}. Tasks are delivered at least once, so handlers
 * must tolerate running twice for the same task.
 */
public interface BillingTaskHandler {

	TaskType taskType();

	void handle(BillingTask task);
}
