package dev.wh40kmeta.scraper.service;

import dev.wh40kmeta.scraper.extract.ExtractorConfig;
import dev.wh40kmeta.scraper.extract.SiteSelectors;
import dev.wh40kmeta.scraper.fetch.FetcherConfig;
import dev.wh40kmeta.scraper.fetch.RateLimitedFetcher;
import dev.wh40kmeta.scraper.url.VersionedUrlResolver;
import java.util.Arrays;
import java.util.List;

/** Factory for creating the scraper service of a source, wired with its fetcher and URL resolver */
public class ScraperServiceFactory {
	private final FetcherConfig fetcherConfig;
	private final SiteSelectors selectors;

	public static ScraperServiceFactory create(FetcherConfig fetcherConfig, SiteSelectors selectors) {
		return new ScraperServiceFactory(fetcherConfig, selectors);
	}

	private ScraperServiceFactory(FetcherConfig fetcherConfig, SiteSelectors selectors) {
		this.fetcherConfig = fetcherConfig;
		this.selectors = selectors;
	}

	/** Create the service of a source for one game version */
	public ScraperService createService(ScrapeSource source, String versionId) {
		var fetcher = new RateLimitedFetcher(fetcherConfig);
		var resolver = new VersionedUrlResolver(fetcherConfig.baseUrl(), versionId);
		var config = new ExtractorConfig(fetcher, resolver, selectors);
		return switch (source) {
			case WAHAPEDIA -> new WahapediaService(config);
		};
	}

	/**
	 * Create the service of a source by id
	 *
	 * @throws IllegalArgumentException for an unknown source id
	 */
	public ScraperService createService(String sourceId, String versionId) {
		return createService(ScrapeSource.of(sourceId), versionId);
	}

	public static List<String> availableSources() {
		return Arrays.stream(ScrapeSource.values()).map(ScrapeSource::id).toList();
	}
}
