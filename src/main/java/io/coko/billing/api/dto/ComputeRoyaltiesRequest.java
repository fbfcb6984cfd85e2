package io.coko.billing.api.dto;

import java.time.LocalDate;

/**
 * Period runs from {@code periodStart} (inclusive) to {@code periodEnd} (exclusive). {@code mode} is COMPUTE (default) or CORRECTION;
 * {@code authorRef} restricts a COMPUTE run to one author.
 */
public class ComputeRoyaltiesRequest {

	private LocalDate periodStart;
	private LocalDate periodEnd;
	private String mode;
	private String authorRef;

	public LocalDate getPeriodStart() {
		return periodStart;
	}

	public void setPeriodStart(LocalDate periodStart) {
		this.periodStart = periodStart;
	}

	public LocalDate getPeriodEnd() {
		return periodEnd;
	}

	public void setPeriodEnd(LocalDate periodEnd) {
		this.periodEnd = periodEnd;
	}

	public String getMode() {
		return mode;
	}

	public void setMode(String mode) {
		this.mode = mode;
	}

	public String getAuthorRef() {
		return authorRef;
	}

	public void setAuthorRef(String authorRef) {
		this.authorRef = authorRef;
	}
}
