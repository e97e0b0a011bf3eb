package dev.wh40kmeta.scraper.extract;

import dev.wh40kmeta.scraper.fetch.RateLimitedFetcher;
import dev.wh40kmeta.scraper.url.VersionedUrlResolver;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all page extractors. An extractor turns one input item into zero or more records;
 * a {@link ParseFailure} marks the item as skipped without affecting the others.
 *
 * @param <I> input item, usually a record produced by an earlier stage
 * @param <O> extracted record
 */
public abstract class BaseExtractor<I, O> {
	public static final String SOURCE = "wahapedia";

	private static final Pattern NUMBER = Pattern.compile("\\d{1,6}");

	protected final Logger logger = LoggerFactory.getLogger(getClass());
	protected final RateLimitedFetcher fetcher;
	protected final VersionedUrlResolver resolver;
	protected final SiteSelectors selectors;
	protected final String versionId;

	private String memoUrl;
	private Document memoDocument;

	protected BaseExtractor(ExtractorConfig config) {
		this.fetcher = config.fetcher();
		this.resolver = config.resolver();
		this.selectors = config.selectors();
		this.versionId = config.versionId();
	}

	/** Name of the stage, used in logs and status messages */
	public abstract String stage();

	/** Human readable label of an input item */
	public abstract String describe(I input);

	/** Extract the records of one item */
	public abstract List<O> extract(I input) throws ParseFailure;

	/** Fetch and parse a page */
	protected Document fetch(String url) throws ParseFailure {
		var document = fetcher.fetchDocument(url);
		if (document.isEmpty()) {
			throw ParseFailure.of(fetcher.lastFailure());
		}
		logger.debug("{} {}", ItemState.FETCHED, url);
		return document.get();
	}

	/**
	 * Fetch a page, reusing the previous document when the same page (ignoring the fragment) is
	 * requested again. Consecutive items of one faction share their page this way.
	 */
	protected Document fetchShared(String url) throws ParseFailure {
		String page = stripFragment(url);
		if (page.equals(memoUrl)) {
			return memoDocument;
		}
		Document document = fetch(page);
		memoUrl = page;
		memoDocument = document;
		return document;
	}

	/** Forget the shared page, e.g. at the end of a run */
	public void reset() {
		memoUrl = null;
		memoDocument = null;
	}

	protected static String stripFragment(String url) {
		int hash = url.indexOf('#');
		return hash >= 0 ? url.substring(0, hash) : url;
	}

	/**
	 * Find the first following sibling of {@code start} that matches {@code selector} or contains a
	 * matching element.
	 *
	 * @param stopSelector siblings matching this end the search, or null to search all siblings
	 * @return the matching element, or null
	 */
	protected static Element findFollowing(Element start, String selector, String stopSelector) {
		for (Element sibling = start.nextElementSibling(); sibling != null; sibling = sibling.nextElementSibling()) {
			if (stopSelector != null && sibling.is(stopSelector)) {
				return null;
			}
			if (sibling.is(selector)) {
				return sibling;
			}
			Element nested = sibling.selectFirst(selector);
			if (nested != null) {
				return nested;
			}
		}
		return null;
	}

	/** Trimmed text of an element, or an empty string for null */
	protected static String text(Element element) {
		return element != null ? element.text().trim() : "";
	}

	/** First integer in a text like "85 pts", or null */
	protected static Integer parsePoints(String text) {
		if (text == null) {
			return null;
		}
		Matcher matcher = NUMBER.matcher(text);
		return matcher.find() ? Integer.valueOf(matcher.group()) : null;
	}
}
