package io.coko.billing.task;

public enum TaskStatus {
	PENDING("PENDING"),
	RUNNING("RUNNING"),
	DONE("DONE"),
	DEAD("DEAD");

	private final String code;

	TaskStatus(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}

	public static TaskStatus fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (TaskStatus status : values()) {
			if (status.code.equalsIgnoreCase(code)) {
				return status;
			}
		}
		return null;
	}
}
