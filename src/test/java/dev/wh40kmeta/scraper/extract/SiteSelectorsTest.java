package dev.wh40kmeta.scraper.extract;

import static org.assertj.core.api.Assertions.*;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class SiteSelectorsTest {

	@Test
	void testBundledSelectorsMatchDefaults() {
		// When
		SiteSelectors loaded = SiteSelectors.load();

		// Then
		assertThat(loaded).isEqualTo(SiteSelectors.defaults());
	}

	@Test
	void testOverride() {
		// Given
		Properties props = new Properties();
		props.setProperty("unit.price-tag", ".Cost");

		// When
		SiteSelectors selectors = SiteSelectors.from(props);

		// Then
		assertThat(selectors.priceTag()).isEqualTo(".Cost");
		assertThat(selectors.unitName()).isEqualTo(SiteSelectors.defaults().unitName());
	}
}
