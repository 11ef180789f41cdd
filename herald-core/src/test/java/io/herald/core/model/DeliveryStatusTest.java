package io.herald.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Locale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeliveryStatusTest {
    private Locale previous;

    @BeforeEach
    void useTurkishLocale() {
        previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(previous);
    }

    @Test
    void wireNamesShouldNotDependOnTheDefaultLocale() {
        assertThat(DeliveryStatus.DELIVERED.wireName()).isEqualTo("delivered");
        assertThat(DeliveryStatus.fromWireName("delivered")).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(DeliveryStatus.fromWireName(" failed ")).isEqualTo(DeliveryStatus.FAILED);
        assertThat(DeliveryStatus.fromWireName("")).isNull();
        assertThat(ContentType.WEEKLY_DIGEST.wireName()).isEqualTo("weekly_digest");
    }
}
