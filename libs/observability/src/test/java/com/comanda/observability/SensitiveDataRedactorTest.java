package com.comanda.observability;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Test
    @DisplayName("masks contact fields and keeps the rest")
    void masksContactFields() {
        var data = new HashMap<String, Object>();
        data.put("name", "Lee");
        data.put("phone", "+1 555 010 4567");
        data.put("Email", "lee@example.com");
        data.put("deliveryAddress", null);

        var redacted = redactor.redact(data);

        assertThat(redacted)
                .containsEntry("name", "Lee")
                .containsEntry("phone", "***4567")
                .containsEntry("Email", "***.com")
                .containsEntry("deliveryAddress", null);
    }

    @Test
    @DisplayName("short values are hidden entirely")
    void shortValues() {
        assertThat(redactor.mask("1234")).isEqualTo(SensitiveDataRedactor.REDACTED);
    }

    @Test
    @DisplayName("custom patterns replace the defaults")
    void customPatterns() {
        var custom = new SensitiveDataRedactor(Set.of("notes"));
        assertThat(custom.isSensitive("customerNotes")).isTrue();
        assertThat(custom.isSensitive("phone")).isFalse();
        assertThat(custom.redact(Map.of())).isEmpty();
    }
}
