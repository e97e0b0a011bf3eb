package dev.wh40kmeta.scraper;

import dev.wh40kmeta.scraper.bus.BusException;
import dev.wh40kmeta.scraper.bus.MessageBus;
import dev.wh40kmeta.scraper.bus.StagePublisher;
import dev.wh40kmeta.scraper.extract.SiteSelectors;
import dev.wh40kmeta.scraper.fetch.FetcherConfig;
import dev.wh40kmeta.scraper.pipeline.ExtractionPipeline;
import dev.wh40kmeta.scraper.pipeline.PipelineConfig;
import dev.wh40kmeta.scraper.pipeline.PipelineResult;
import dev.wh40kmeta.scraper.pipeline.StageResult;
import dev.wh40kmeta.scraper.service.ScrapeSource;
import dev.wh40kmeta.scraper.service.ScraperService;
import dev.wh40kmeta.scraper.service.ScraperServiceFactory;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/** Run command to scrape a game version and publish the results */
@Command(
		name = "run",
		description = "Scrape factions, rules, detachments, enhancements, units and wargear and publish them",
		mixinStandardHelpOptions = true)
public class RunCommand implements Callable<Integer> {

	@Option(
			names = {"-g", "--game-version"},
			description = "Game version to scrape, e.g. 10th (default: $GAME_VERSION_ID or 10th)",
			defaultValue = "${env:GAME_VERSION_ID:-10th}")
	private String versionId;

	@Option(
			names = {"-f", "--factions"},
			description = "Comma-separated faction codes or names to scrape (if not specified, all factions)",
			split = ",")
	private List<String> factions;

	@Option(
			names = {"-s", "--source"},
			description = "Rules source to scrape (default: $SCRAPER_SERVICE or wahapedia)",
			defaultValue = "${env:SCRAPER_SERVICE:-wahapedia}")
	private String source;

	@Option(
			names = {"-l", "--list"},
			description = "List all available sources and exit")
	private boolean listSources;

	@Option(
			names = {"--base-url"},
			description = "Upstream host (default: $WAHAPEDIA_BASE_URL or https://wahapedia.ru)",
			defaultValue = "${env:WAHAPEDIA_BASE_URL:-https://wahapedia.ru}")
	private String baseUrl;

	@Option(
			names = {"--rate-limit-min"},
			description = "Minimum seconds between requests (default: $RATE_LIMIT_MIN or 2.0)",
			defaultValue = "${env:RATE_LIMIT_MIN:-2.0}")
	private double rateLimitMin;

	@Option(
			names = {"--rate-limit-max"},
			description = "Maximum seconds between requests (default: $RATE_LIMIT_MAX or 3.0)",
			defaultValue = "${env:RATE_LIMIT_MAX:-3.0}")
	private double rateLimitMax;

	@Option(
			names = {"--skip-wargear"},
			description = "Do not fetch wargear options of units")
	private boolean skipWargear;

	@Mixin
	private BusOptions busOptions;

	@Mixin
	private DatabaseOptions databaseOptions;

	@Override
	public Integer call() throws Exception {
		if (listSources) {
			System.out.println("Available Sources:");
			System.out.println("==================");
			ScraperServiceFactory.availableSources().forEach(name -> System.out.println("  - " + name));
			return 0;
		}

		ScrapeSource scrapeSource;
		try {
			scrapeSource = ScrapeSource.of(source);
		} catch (IllegalArgumentException e) {
			System.err.println("Error: " + e.getMessage());
			return 1;
		}

		var fetcherConfig = FetcherConfig.defaults()
				.withBaseUrl(baseUrl)
				.withDelays(seconds(rateLimitMin), seconds(rateLimitMax));
		var pipelineConfig = PipelineConfig.of(scrapeSource, versionId, factions);
		if (skipWargear) {
			pipelineConfig = pipelineConfig.withoutWargear();
		}

		System.out.println("Wahapedia Scraper - Run");
		System.out.println("=======================");
		System.out.println("Source: " + scrapeSource.id() + " (" + fetcherConfig.baseUrl() + ")");
		System.out.println("Game version: " + versionId);
		System.out.println("Factions: " + (pipelineConfig.factionFilter().isEmpty() ? "all" : pipelineConfig.factionFilter()));
		System.out.println("Message bus: " + (busOptions.localBus ? "local" : busOptions.settings()));
		System.out.println();

		MessageBus bus;
		try {
			bus = busOptions.openBus();
		} catch (BusException e) {
			System.err.println("Error: " + e.getMessage());
			return 1;
		}

		try (bus) {
			ScraperService service =
					ScraperServiceFactory.create(fetcherConfig, SiteSelectors.load()).createService(scrapeSource, versionId);
			var pipeline = new ExtractionPipeline(
					service,
					new StagePublisher(bus, versionId),
					databaseOptions.repository().orElse(null),
					pipelineConfig);

			long startTime = System.currentTimeMillis();
			PipelineResult result = pipeline.run();

			System.out.println();
			System.out.println("Execution Summary");
			System.out.println("=================");
			for (StageResult<?> stage : result.stages()) {
				System.out.println("  " + stage);
			}
			System.out.println();
			System.out.println("Result: " + result);
			System.out.println("Completed in " + (System.currentTimeMillis() - startTime) / 1000.0 + " seconds");

			return result.success() ? 0 : 1;
		}
	}

	private static Duration seconds(double seconds) {
		return Duration.ofMillis(Math.round(seconds * 1000));
	}
}
