package dev.wh40kmeta.scraper.pipeline;

import dev.wh40kmeta.scraper.extract.ParseFailure;
import java.util.List;

/** Extraction of the records of one input item */
@FunctionalInterface
public interface ItemExtraction<I, O> {
	List<O> extract(I input) throws ParseFailure;
}
