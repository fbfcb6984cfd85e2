package io.coko.billing.task;

public enum TaskType {
	/** Apply the downstream effects of a newly recorded ledger transaction. */
	APPLY_TRANSACTION("APPLY_TRANSACTION"),
	/** Run the royalty batch for one period. */
	COMPUTE_ROYALTIES("COMPUTE_ROYALTIES");

	private final String code;

	TaskType(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}

	public static TaskType fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (TaskType type : values()) {
			if (type.code.equalsIgnoreCase(code)) {
				return type;
			}
		}
		return null;
	}
}
