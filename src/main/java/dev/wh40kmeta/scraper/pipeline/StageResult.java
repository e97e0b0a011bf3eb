package dev.wh40kmeta.scraper.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Result of one extraction stage */
public record StageResult<O>(
		String stage,
		boolean success,
		List<O> records,
		int itemsEmitted,
		int itemsSkipped,
		int itemsFailed,
		Exception error) {

	public static <O> StageResult<O> success(
			String stage, List<O> records, int itemsEmitted, int itemsSkipped, int itemsFailed) {
		return new StageResult<>(stage, true, List.copyOf(records), itemsEmitted, itemsSkipped, itemsFailed, null);
	}

	public static <O> StageResult<O> failure(String stage, Exception error) {
		return new StageResult<>(stage, false, List.of(), 0, 0, 0, error);
	}

	/** True when at least one item yielded nothing because of a failure */
	public boolean partial() {
		return itemsSkipped > 0 || itemsFailed > 0;
	}

	/** Counts as published in status messages */
	public Map<String, Object> details() {
		Map<String, Object> details = new LinkedHashMap<>();
		details.put("stage", stage);
		details.put("records", records.size());
		details.put("emitted", itemsEmitted);
		details.put("skipped", itemsSkipped);
		details.put("failed", itemsFailed);
		if (error != null) {
			details.put("error", error.getMessage());
		}
		return details;
	}

	@Override
	public String toString() {
		return success
				? "%s: SUCCESS (%d records from %d items, %d items skipped, %d items failed)"
						.formatted(stage, records.size(), itemsEmitted, itemsSkipped, itemsFailed)
				: "%s: FAILED - %s".formatted(stage, error != null ? error.getMessage() : "Unknown error");
	}
}
