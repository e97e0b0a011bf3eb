package dev.wh40kmeta.scraper.extract;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CSS selectors for the upstream markup. Defaults are bundled in {@code wahapedia-selectors.properties}
 * so that markup drift can be handled without touching the extractors.
 */
public record SiteSelectors(
		String factionNavButton,
		String factionDropdownClass,
		String factionLink,
		String armyRulesAnchor,
		String columnsContainer,
		String block,
		String ruleHeading,
		String fallbackHeading,
		String sectionAnchor,
		String detachmentAnchor,
		String detachmentHeader,
		String enhancementAnchor,
		String enhancementTable,
		String enhancementItem,
		String datasheet,
		String unitName,
		String priceTag,
		String wargearHeading,
		String wargearList,
		String wargearItem) {
	private static final Logger logger = LoggerFactory.getLogger(SiteSelectors.class);

	public static final String RESOURCE = "/wahapedia-selectors.properties";

	public static SiteSelectors defaults() {
		return new SiteSelectors(
				".NavBtn_Factions",
				"NavDropdown-content",
				".BreakInsideAvoid a",
				"a[name=Army-Rules]",
				"div.Columns2",
				"div.BreakInsideAvoid",
				"h3",
				"h2",
				"a[name]",
				"a[name*=Detachment-Rule]",
				"h2.outline_header",
				"a[name*=Enhancements]",
				"table",
				"tbody tr td ul li",
				"div.datasheet:not([style*=\"display: none\"])",
				".dsH2Header > div",
				".PriceTag",
				"WARGEAR OPTIONS",
				"ul",
				"li");
	}

	/** Load the bundled selectors, falling back to the built-in defaults for missing keys */
	public static SiteSelectors load() {
		try (InputStream in = SiteSelectors.class.getResourceAsStream(RESOURCE)) {
			if (in == null) {
				logger.warn("Selector resource {} not found, using built-in defaults", RESOURCE);
				return defaults();
			}
			Properties props = new Properties();
			props.load(in);
			return from(props);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + RESOURCE, e);
		}
	}

	public static SiteSelectors from(Properties props) {
		SiteSelectors d = defaults();
		return new SiteSelectors(
				props.getProperty("faction.nav-button", d.factionNavButton()),
				props.getProperty("faction.dropdown-class", d.factionDropdownClass()),
				props.getProperty("faction.link", d.factionLink()),
				props.getProperty("army-rule.anchor", d.armyRulesAnchor()),
				props.getProperty("layout.columns", d.columnsContainer()),
				props.getProperty("layout.block", d.block()),
				props.getProperty("layout.rule-heading", d.ruleHeading()),
				props.getProperty("layout.fallback-heading", d.fallbackHeading()),
				props.getProperty("layout.section-anchor", d.sectionAnchor()),
				props.getProperty("detachment.anchor", d.detachmentAnchor()),
				props.getProperty("detachment.header", d.detachmentHeader()),
				props.getProperty("enhancement.anchor", d.enhancementAnchor()),
				props.getProperty("enhancement.table", d.enhancementTable()),
				props.getProperty("enhancement.item", d.enhancementItem()),
				props.getProperty("unit.datasheet", d.datasheet()),
				props.getProperty("unit.name", d.unitName()),
				props.getProperty("unit.price-tag", d.priceTag()),
				props.getProperty("wargear.heading", d.wargearHeading()),
				props.getProperty("wargear.list", d.wargearList()),
				props.getProperty("wargear.item", d.wargearItem()));
	}
}
