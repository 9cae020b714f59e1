package me.golemcore.gateway.usage;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PricingTableTest {

    @Test
    void shouldReturnListedPrice() {
        PricingTable.Price price = PricingTable.priceOf("anthropic", "claude-opus-4");
        assertEquals(15.0, price.inputPerMillion());
        assertEquals(75.0, price.outputPerMillion());
    }

    @Test
    void shouldPriceDatedSnapshotAsCatalogueModel() {
        assertEquals(PricingTable.priceOf("anthropic", "claude-sonnet-4"),
                PricingTable.priceOf("anthropic", "claude-sonnet-4-20250514"));
        assertEquals(new PricingTable.Price(0.80, 4.00),
                PricingTable.priceOf("anthropic", "claude-3-5-haiku-20241022"));
    }

    @Test
    void shouldUseProviderDefaultEntry() {
        assertEquals(new PricingTable.Price(0, 0), PricingTable.priceOf("openrouter", "anything"));
    }

    @Test
    void shouldReturnFreeForUnknownProvider() {
        assertEquals(new PricingTable.Price(0, 0), PricingTable.priceOf("acme", "gpt-9"));
        assertEquals(new PricingTable.Price(0, 0), PricingTable.priceOf(null, "deepseek-chat"));
    }

    @Test
    void shouldExposeWholeTable() {
        assertTrue(PricingTable.all().containsKey("deepseek"));
        assertTrue(PricingTable.all().get("groq").containsKey("llama-3.3-70b"));
    }
}
