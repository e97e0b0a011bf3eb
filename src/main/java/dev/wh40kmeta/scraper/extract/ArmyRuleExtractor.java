package dev.wh40kmeta.scraper.extract;

import dev.wh40kmeta.scraper.model.ArmyRule;
import dev.wh40kmeta.scraper.model.Faction;
import java.util.List;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Extracts the army rule name of a faction. The rule is the first block of the two-column layout
 * following the Army-Rules anchor. Pages without that layout are searched for a block directly
 * after the anchor, but never past the next section anchor.
 */
public class ArmyRuleExtractor extends BaseExtractor<Faction, ArmyRule> {

	public ArmyRuleExtractor(ExtractorConfig config) {
		super(config);
	}

	@Override
	public String stage() {
		return "army_rules";
	}

	@Override
	public String describe(Faction faction) {
		return faction.name();
	}

	@Override
	public List<ArmyRule> extract(Faction faction) throws ParseFailure {
		if (faction.url() == null || faction.url().isBlank()) {
			throw new ParseFailure("No URL for faction " + faction.name());
		}
		Document document = fetchShared(faction.url());

		Element anchor = document.selectFirst(selectors.armyRulesAnchor());
		if (anchor == null) {
			throw new ParseFailure("No Army Rules anchor found for " + faction.name());
		}

		Element block = ruleBlock(anchor, faction);
		if (block == null) {
			throw new ParseFailure("No rule block found after Army Rules anchor for " + faction.name());
		}

		Element heading = block.selectFirst(selectors.ruleHeading());
		if (heading == null) {
			heading = block.selectFirst(selectors.fallbackHeading());
		}
		String ruleName = text(heading);
		if (ruleName.isEmpty()) {
			throw new ParseFailure("No army rule heading found for " + faction.name());
		}

		logger.info("Found army rule for {}: {}", faction.name(), ruleName);
		return List.of(new ArmyRule(faction.name(), faction.code(), faction.url(), ruleName, SOURCE, versionId));
	}

	private Element ruleBlock(Element anchor, Faction faction) {
		for (Element sibling = anchor.nextElementSibling(); sibling != null; sibling = sibling.nextElementSibling()) {
			if (sibling.is(selectors.columnsContainer())) {
				return sibling.selectFirst(selectors.block());
			}
		}
		logger.debug("No column layout after Army Rules anchor for {}, looking for a block before the next section", faction.name());
		for (Element sibling = anchor.nextElementSibling(); sibling != null; sibling = sibling.nextElementSibling()) {
			if (sibling.is(selectors.sectionAnchor())) {
				return null;
			}
			if (sibling.is(selectors.block())) {
				return sibling;
			}
		}
		return null;
	}
}
