package com.kiestudio;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Pricing")
class PricingTest {

    @Test
    @DisplayName("z-image costs about 0.62 rubles for a regular user")
    void zImageUserPrice() {
        BigDecimal price = Pricing.price("z-image", Map.of(), Role.USER);

        assertThat(price).isCloseTo(new BigDecimal("0.6178"), within(new BigDecimal("0.0001")));
        assertThat(Pricing.format(price)).isEqualTo("0.62");
    }

    @Test
    @DisplayName("admins pay the unmarked-up price")
    void adminPriceIsHalfOfUserPrice() {
        BigDecimal user = Pricing.price("seedream/4.5-edit", Map.of(), Role.USER);
        BigDecimal admin = Pricing.price("seedream/4.5-edit", Map.of(), Role.LIMITED_ADMIN);

        assertThat(user).isEqualByComparingTo(admin.multiply(BigDecimal.valueOf(2)));
        assertThat(Pricing.price("seedream/4.5-edit", Map.of(), Role.PRIMARY_ADMIN)).isEqualByComparingTo(admin);
    }

    @Test
    @DisplayName("nano-banana-pro is dearer at 4K")
    void nanoBananaProResolution() {
        assertThat(Pricing.baseCredits("nano-banana-pro", Map.of("resolution", "4K"))).isEqualByComparingTo("24");
        assertThat(Pricing.baseCredits("nano-banana-pro", Map.of("resolution", "2K"))).isEqualByComparingTo("18");
        assertThat(Pricing.baseCredits("nano-banana-pro", Map.of())).isEqualByComparingTo("18");

        BigDecimal admin4k = Pricing.price("nano-banana-pro", Map.of("resolution", "4K"), Role.LIMITED_ADMIN);
        assertThat(admin4k).isCloseTo(new BigDecimal("9.2667"), within(new BigDecimal("0.0001")));
    }

    @Test
    @DisplayName("unknown models fall back to one credit")
    void unknownModelDefaultsToOneCredit() {
        assertThat(Pricing.baseCredits("something-new", null)).isEqualByComparingTo("1");
        assertThat(Pricing.price("something-new", Map.of(), Role.LIMITED_ADMIN))
                .isEqualByComparingTo(Pricing.creditsToRub(BigDecimal.ONE));
    }

    @Test
    @DisplayName("minimum price uses schema defaults")
    void minimumPriceUsesDefaults() {
        ModelSchema schema = new ModelSchema("nano-banana-pro", "Nano", "", "Фото", "🍌", "", Messenger.MediaKind.IMAGE,
                null, List.of(
                new ParamSpec.Text("prompt", "", true, 100),
                new ParamSpec.Choice("resolution", "", false, List.of("1K", "2K", "4K"), "4K")));

        assertThat(Pricing.minimumPrice(schema, Role.LIMITED_ADMIN))
                .isEqualByComparingTo(Pricing.price("nano-banana-pro", Map.of("resolution", "4K"), Role.LIMITED_ADMIN));
    }

    @Test
    @DisplayName("format rounds half up to two decimals")
    void formatRounding() {
        assertThat(Pricing.format(new BigDecimal("1.005"))).isEqualTo("1.01");
        assertThat(Pricing.format(new BigDecimal("100"))).isEqualTo("100.00");
    }
}
