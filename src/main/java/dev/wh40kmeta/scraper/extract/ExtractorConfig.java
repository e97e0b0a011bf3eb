package dev.wh40kmeta.scraper.extract;

import dev.wh40kmeta.scraper.fetch.RateLimitedFetcher;
import dev.wh40kmeta.scraper.url.VersionedUrlResolver;

/** Shared dependencies of the extractors of one run */
public record ExtractorConfig(RateLimitedFetcher fetcher, VersionedUrlResolver resolver, SiteSelectors selectors) {

	public String versionId() {
		return resolver.versionId();
	}
}
