package dev.wh40kmeta.scraper.service;

import dev.wh40kmeta.scraper.extract.ArmyRuleExtractor;
import dev.wh40kmeta.scraper.extract.DetachmentExtractor;
import dev.wh40kmeta.scraper.extract.EnhancementExtractor;
import dev.wh40kmeta.scraper.extract.ExtractorConfig;
import dev.wh40kmeta.scraper.extract.FactionListExtractor;
import dev.wh40kmeta.scraper.extract.ParseFailure;
import dev.wh40kmeta.scraper.extract.UnitExtractor;
import dev.wh40kmeta.scraper.extract.WargearExtractor;
import dev.wh40kmeta.scraper.model.ArmyRule;
import dev.wh40kmeta.scraper.model.Detachment;
import dev.wh40kmeta.scraper.model.Enhancement;
import dev.wh40kmeta.scraper.model.Faction;
import dev.wh40kmeta.scraper.model.Unit;
import dev.wh40kmeta.scraper.model.Wargear;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Wahapedia implementation of {@link ScraperService}, backed by one extractor per capability */
public class WahapediaService implements ScraperService {
	private static final Logger logger = LoggerFactory.getLogger(WahapediaService.class);

	private final ExtractorConfig config;
	private final FactionListExtractor factionList;
	private final ArmyRuleExtractor armyRules;
	private final DetachmentExtractor detachments;
	private final EnhancementExtractor enhancements;
	private final UnitExtractor units;
	private final WargearExtractor wargear;

	public WahapediaService(ExtractorConfig config) {
		this.config = config;
		this.factionList = new FactionListExtractor(config);
		this.armyRules = new ArmyRuleExtractor(config);
		this.detachments = new DetachmentExtractor(config);
		this.enhancements = new EnhancementExtractor(config);
		this.units = new UnitExtractor(config);
		this.wargear = new WargearExtractor(config);
		logger.info(
				"Wahapedia service initialized for version {} ({})",
				config.versionId(),
				config.resolver().versionPath());
	}

	@Override
	public ScrapeSource source() {
		return ScrapeSource.WAHAPEDIA;
	}

	@Override
	public String versionId() {
		return config.versionId();
	}

	@Override
	public List<Faction> factions() throws ParseFailure {
		return factionList.extract();
	}

	@Override
	public List<ArmyRule> armyRules(Faction faction) throws ParseFailure {
		if (!isValid(faction)) {
			throw new ParseFailure("Invalid faction: " + faction);
		}
		return armyRules.extract(faction);
	}

	@Override
	public List<Detachment> detachments(Faction faction) throws ParseFailure {
		if (!isValid(faction)) {
			throw new ParseFailure("Invalid faction: " + faction);
		}
		return detachments.extract(faction);
	}

	@Override
	public List<Enhancement> enhancements(Detachment detachment) throws ParseFailure {
		return enhancements.extract(detachment);
	}

	@Override
	public List<Unit> units(Faction faction) throws ParseFailure {
		if (!isValid(faction)) {
			throw new ParseFailure("Invalid faction: " + faction);
		}
		return units.extract(faction);
	}

	@Override
	public List<Wargear> wargear(Unit unit) throws ParseFailure {
		return wargear.extract(unit);
	}
}
