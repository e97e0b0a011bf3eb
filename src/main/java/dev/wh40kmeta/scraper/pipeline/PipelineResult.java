package dev.wh40kmeta.scraper.pipeline;

import dev.wh40kmeta.scraper.model.Unit;
import java.util.List;

/** Result of a pipeline run */
public record PipelineResult(boolean success, List<StageResult<?>> stages, List<Unit> units) {

	/** True when the run completed but some items yielded nothing */
	public boolean partial() {
		return stages.stream().anyMatch(StageResult::partial);
	}

	public int recordCount() {
		return stages.stream().mapToInt(s -> s.records().size()).sum();
	}

	public StageResult<?> stage(String name) {
		return stages.stream().filter(s -> s.stage().equals(name)).findFirst().orElse(null);
	}

	@Override
	public String toString() {
		String status = !success ? "FAILED" : partial() ? "PARTIAL" : "SUCCESS";
		return "%s (%d records in %d stages)".formatted(status, recordCount(), stages.size());
	}
}
