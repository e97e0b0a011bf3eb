package dev.wh40kmeta.scraper.extract;

import dev.wh40kmeta.scraper.model.Detachment;
import dev.wh40kmeta.scraper.model.Faction;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/** Extracts the detachments listed on a faction page, one per Detachment-Rule anchor */
public class DetachmentExtractor extends BaseExtractor<Faction, Detachment> {

	public DetachmentExtractor(ExtractorConfig config) {
		super(config);
	}

	@Override
	public String stage() {
		return "detachments";
	}

	@Override
	public String describe(Faction faction) {
		return faction.name();
	}

	@Override
	public List<Detachment> extract(Faction faction) throws ParseFailure {
		if (faction.url() == null || faction.url().isBlank()) {
			throw new ParseFailure("No URL for faction " + faction.name());
		}
		Document document = fetchShared(faction.url());

		var anchors = document.select(selectors.detachmentAnchor());
		if (anchors.isEmpty()) {
			throw new ParseFailure("No detachment anchors found for " + faction.name());
		}

		List<Detachment> detachments = new ArrayList<>();
		for (Element anchor : anchors) {
			Element header = findFollowing(anchor, selectors.detachmentHeader(), selectors.detachmentAnchor());
			String name = text(header);
			if (name.isEmpty()) {
				logger.warn("No detachment header after anchor {} for {}", anchor.attr("name"), faction.name());
				continue;
			}
			Element block = findFollowing(header, selectors.block(), selectors.detachmentAnchor());
			String ruleName = block != null ? text(block.selectFirst(selectors.ruleHeading())) : "";
			if (ruleName.isEmpty()) {
				logger.warn("No detachment rule found for {} of {}", name, faction.name());
			}
			detachments.add(new Detachment(
					name, faction.code(), ruleName.isEmpty() ? null : ruleName, SOURCE, versionId, faction.url(),
					anchor.attr("name")));
		}
		logger.info("Found {} detachments for {}", detachments.size(), faction.name());
		return detachments;
	}
}
