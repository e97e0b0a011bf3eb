package dev.wh40kmeta.scraper.service;

import dev.wh40kmeta.scraper.extract.ParseFailure;
import dev.wh40kmeta.scraper.model.ArmyRule;
import dev.wh40kmeta.scraper.model.Detachment;
import dev.wh40kmeta.scraper.model.Enhancement;
import dev.wh40kmeta.scraper.model.Faction;
import dev.wh40kmeta.scraper.model.Unit;
import dev.wh40kmeta.scraper.model.Wargear;
import java.util.List;

/**
 * Extraction capabilities of one rules source. Every method handles a single item; a {@link
 * ParseFailure} means that item yielded nothing and the caller moves on to the next.
 */
public interface ScraperService {

	ScrapeSource source();

	String versionId();

	List<Faction> factions() throws ParseFailure;

	List<ArmyRule> armyRules(Faction faction) throws ParseFailure;

	List<Detachment> detachments(Faction faction) throws ParseFailure;

	List<Enhancement> enhancements(Detachment detachment) throws ParseFailure;

	List<Unit> units(Faction faction) throws ParseFailure;

	List<Wargear> wargear(Unit unit) throws ParseFailure;

	/** A faction needs a name and a code to be scraped further */
	default boolean isValid(Faction faction) {
		return faction != null
				&& faction.name() != null
				&& !faction.name().isBlank()
				&& faction.code() != null
				&& !faction.code().isBlank();
	}
}
