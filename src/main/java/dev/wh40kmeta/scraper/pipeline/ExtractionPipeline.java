package dev.wh40kmeta.scraper.pipeline;

import dev.wh40kmeta.scraper.bus.Channel;
import dev.wh40kmeta.scraper.bus.MessageType;
import dev.wh40kmeta.scraper.bus.StagePublisher;
import dev.wh40kmeta.scraper.model.ArmyRule;
import dev.wh40kmeta.scraper.model.Detachment;
import dev.wh40kmeta.scraper.model.Enhancement;
import dev.wh40kmeta.scraper.model.Faction;
import dev.wh40kmeta.scraper.model.Unit;
import dev.wh40kmeta.scraper.model.Wargear;
import dev.wh40kmeta.scraper.persistence.ScrapeLogEntry;
import dev.wh40kmeta.scraper.persistence.ScrapeLogException;
import dev.wh40kmeta.scraper.persistence.ScrapeLogRepository;
import dev.wh40kmeta.scraper.service.ScraperService;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the extraction stages in order on the calling thread. Factions seed the army rule,
 * detachment and unit stages, detachments seed the enhancement stage and units seed the wargear
 * stage. The run ends with a single completed or failed status summarizing every stage.
 */
public class ExtractionPipeline {
	private static final Logger logger = LoggerFactory.getLogger(ExtractionPipeline.class);

	private final ScraperService service;
	private final StagePublisher publisher;
	private final StageRunner runner;
	private final ScrapeLogRepository scrapeLog;
	private final PipelineConfig config;

	/**
	 * @param scrapeLog where to record the run, or null to skip recording
	 */
	public ExtractionPipeline(
			ScraperService service, StagePublisher publisher, ScrapeLogRepository scrapeLog, PipelineConfig config) {
		this.service = service;
		this.publisher = publisher;
		this.runner = new StageRunner(publisher);
		this.scrapeLog = scrapeLog;
		this.config = config;
	}

	public PipelineResult run() {
		Instant startedAt = Instant.now();
		logger.info(
				"Starting {} scrape of version {}{}",
				config.source().id(),
				config.versionId(),
				config.factionFilter().isEmpty() ? "" : " for factions " + config.factionFilter());
		publisher.status(
				"started",
				Map.of("task", "pipeline", "source", config.source().id(), "version_id", config.versionId()));
		announceVersion();

		List<StageResult<?>> stages = new ArrayList<>();

		StageResult<Faction> factions = runner.runSource(
				"factions",
				service::factions,
				publisher::factions);
		stages.add(factions);
		if (!factions.success()) {
			return finish(startedAt, stages, List.of());
		}

		List<Faction> selected = factions.records().stream()
				.filter(f -> config.selects(f.code(), f.name()))
				.toList();
		if (selected.size() != factions.records().size()) {
			logger.info("Selected {} of {} factions", selected.size(), factions.records().size());
		}

		StageResult<ArmyRule> armyRules = runner.run(
				"army_rules",
				selected,
				Faction::name,
				service::armyRules,
				records -> publisher.batch(MessageType.ARMY_RULE_EXTRACTED, Channel.ARMY_RULE_EXTRACTED, records));
		stages.add(armyRules);

		StageResult<Detachment> detachments = runner.run(
				"detachments",
				selected,
				Faction::name,
				service::detachments,
				records -> publisher.batch(MessageType.DETACHMENT_EXTRACTED, Channel.DETACHMENT_EXTRACTED, records));
		stages.add(detachments);

		StageResult<Enhancement> enhancements = runner.run(
				"enhancements",
				detachments.records(),
				d -> d.factionCode() + "/" + d.name(),
				service::enhancements,
				records -> publisher.batch(MessageType.ENHANCEMENT_FOUND, Channel.ENHANCEMENT_FOUND, records));
		stages.add(enhancements);

		StageResult<Unit> units = runner.run(
				"units", selected, Faction::name, service::units, records -> records.forEach(unit -> publisher.item(
						MessageType.UNIT_EXTRACTED, Channel.UNIT_EXTRACTED, unit)));
		stages.add(units);

		List<Unit> finalUnits = units.records();
		if (config.wargear()) {
			StageResult<Wargear> wargear = runner.run(
					"wargear",
					units.records(),
					u -> u.factionCode() + "/" + u.name(),
					service::wargear,
					records -> publisher.batch(MessageType.WARGEAR_FOUND, Channel.WARGEAR_FOUND, records));
			stages.add(wargear);
			finalUnits = withWargear(units.records(), wargear.records());
		}

		return finish(startedAt, stages, finalUnits);
	}

	private static List<Unit> withWargear(List<Unit> units, List<Wargear> wargear) {
		Map<String, List<String>> byUnit = new HashMap<>();
		for (Wargear option : wargear) {
			byUnit.computeIfAbsent(option.factionCode() + "/" + option.unitName(), k -> new ArrayList<>())
					.add(option.name());
		}
		return units.stream()
				.map(u -> u.withWargear(byUnit.getOrDefault(u.factionCode() + "/" + u.name(), List.of())))
				.toList();
	}

	private void announceVersion() {
		Optional<String> previous = publisher.lastAnnouncedVersion();
		if (previous.isPresent() && previous.get().equals(config.versionId())) {
			return;
		}
		logger.info("Game version changed from {} to {}", previous.orElse("(none)"), config.versionId());
		publisher.versionChange(previous.orElse(null), config.versionId());
	}

	private PipelineResult finish(Instant startedAt, List<StageResult<?>> stages, List<Unit> units) {
		boolean success = stages.stream().allMatch(StageResult::success);
		PipelineResult result = new PipelineResult(success, List.copyOf(stages), units);

		Map<String, Object> stageDetails = new LinkedHashMap<>();
		int processed = 0;
		int failed = 0;
		for (StageResult<?> stage : stages) {
			stageDetails.put(stage.stage(), stage.details());
			processed += stage.records().size();
			failed += stage.itemsSkipped() + stage.itemsFailed();
		}
		Instant completedAt = Instant.now();
		Map<String, Object> details = new LinkedHashMap<>();
		details.put("task", "pipeline");
		details.put("version_id", config.versionId());
		details.put("partial", result.partial());
		details.put("items_processed", processed);
		details.put("items_failed", failed);
		details.put("duration_seconds", Duration.between(startedAt, completedAt).toMillis() / 1000.0);
		details.put("stages", stageDetails);
		String error = stages.stream()
				.map(StageResult::error)
				.filter(Objects::nonNull)
				.map(Exception::getMessage)
				.findFirst()
				.orElse(null);
		if (error != null) {
			details.put("error", error);
		}
		publisher.status(success ? "completed" : "failed", details);

		if (success) {
			logger.info("Pipeline completed: {}", result);
		} else {
			logger.error("Pipeline failed: {}", result);
		}
		record(new ScrapeLogEntry(
				config.source().id(),
				config.factionFilter().isEmpty() ? "full" : "faction",
				success ? "completed" : "failed",
				startedAt,
				completedAt,
				processed,
				failed,
				error));
		return result;
	}

	private void record(ScrapeLogEntry entry) {
		if (scrapeLog == null) {
			return;
		}
		try {
			scrapeLog.write(entry);
		} catch (ScrapeLogException e) {
			logger.warn("Could not record scrape log: {}", e.getMessage());
		}
	}
}
