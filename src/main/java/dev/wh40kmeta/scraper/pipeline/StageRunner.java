package dev.wh40kmeta.scraper.pipeline;

import dev.wh40kmeta.scraper.bus.StagePublisher;
import dev.wh40kmeta.scraper.extract.ItemState;
import dev.wh40kmeta.scraper.extract.ParseFailure;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a stage over its input items. Every stage announces itself with a started status, emits its
 * records and ends with a completed status carrying the counts, also when there were no items.
 */
public class StageRunner {
	private static final Logger logger = LoggerFactory.getLogger(StageRunner.class);

	/** Extraction of a stage that has no input items */
	@FunctionalInterface
	public interface SourceExtraction<O> {
		List<O> extract() throws ParseFailure;
	}

	private final StagePublisher publisher;

	public StageRunner(StagePublisher publisher) {
		this.publisher = publisher;
	}

	/**
	 * Run a stage over a list of items. A failing item is logged and skipped; only a failure to emit
	 * the records fails the stage.
	 *
	 * @param emit called once with all records of the stage
	 */
	public <I, O> StageResult<O> run(
			String stage,
			List<I> inputs,
			Function<I, String> describe,
			ItemExtraction<I, O> extraction,
			Consumer<List<O>> emit) {
		publisher.status("started", Map.of("stage", stage, "items", inputs.size()));
		logger.info("Starting stage {} for {} items", stage, inputs.size());

		List<O> records = new ArrayList<>();
		int emitted = 0;
		int skipped = 0;
		int failed = 0;
		for (I input : inputs) {
			String label = describe.apply(input);
			logger.debug("{} {} {}", stage, label, ItemState.PENDING);
			try {
				List<O> output = extraction.extract(input);
				logger.debug("{} {} {} ({} records)", stage, label, ItemState.PARSED, output.size());
				records.addAll(output);
				emitted++;
				logger.debug("{} {} {}", stage, label, ItemState.EMITTED);
			} catch (ParseFailure e) {
				if (e.isFetchFailure()) {
					failed++;
				} else {
					skipped++;
				}
				logger.warn("Skipping {} for {}: {}", stage, label, e.getMessage());
				logger.debug("{} {} {}", stage, label, ItemState.SKIPPED);
			} catch (RuntimeException e) {
				failed++;
				logger.error("Unexpected error in {} for {}: {}", stage, label, e.getMessage(), e);
				logger.debug("{} {} {}", stage, label, ItemState.SKIPPED);
			}
		}
		try {
			emit.accept(records);
		} catch (RuntimeException e) {
			return failed(stage, e);
		}

		StageResult<O> result = StageResult.success(stage, records, emitted, skipped, failed);
		logger.info("Completed stage {}: {} records from {} items, skipped {} items, {} failures",
				stage, records.size(), emitted, skipped, failed);
		publisher.status("completed", result.details());
		return result;
	}

	/**
	 * Run a stage that reads a single page. Failing to extract that page fails the stage.
	 */
	public <O> StageResult<O> runSource(String stage, SourceExtraction<O> extraction, Consumer<List<O>> emit) {
		publisher.status("started", Map.of("stage", stage));
		logger.info("Starting stage {}", stage);
		try {
			List<O> records = extraction.extract();
			emit.accept(records);
			StageResult<O> result = StageResult.success(stage, records, 1, 0, 0);
			logger.info("Completed stage {}: {} records", stage, records.size());
			publisher.status("completed", result.details());
			return result;
		} catch (ParseFailure | RuntimeException e) {
			return failed(stage, e);
		}
	}

	private <O> StageResult<O> failed(String stage, Exception e) {
		logger.error("Stage {} failed: {}", stage, e.getMessage());
		Map<String, Object> details = new LinkedHashMap<>();
		details.put("stage", stage);
		details.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
		publisher.status("failed", details);
		return StageResult.failure(stage, e);
	}
}
