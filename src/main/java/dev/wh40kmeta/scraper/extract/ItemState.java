package dev.wh40kmeta.scraper.extract;

/** Lifecycle of one item within a stage */
public enum ItemState {
	PENDING,
	FETCHED,
	PARSED,
	EMITTED,
	SKIPPED
}
