package com.fedsearch.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CacheKeys")
class CacheKeysTest {

    @Test
    @DisplayName("prefixes the key with the connection id")
    void format() {
        assertThat(CacheKeys.forQuery("shop", "SELECT 1", List.of())).matches("shop:[0-9a-f]{16}");
    }

    @Test
    @DisplayName("ignores whitespace and trailing semicolons")
    void cosmetic() {
        String key = CacheKeys.forQuery("shop", "SELECT id FROM orders LIMIT 10", List.of());

        assertThat(CacheKeys.forQuery("shop", "  SELECT id\n  FROM   orders LIMIT 10 ;; ", List.of())).isEqualTo(key);
        assertThat(CacheKeys.normalizeSql(null)).isEmpty();
    }

    @Test
    @DisplayName("separates connections, statements and parameters")
    void distinct() {
        String key = CacheKeys.forQuery("shop", "SELECT * FROM t WHERE id = ?", List.of(1));

        assertThat(CacheKeys.forQuery("crm", "SELECT * FROM t WHERE id = ?", List.of(1))).isNotEqualTo(key);
        assertThat(CacheKeys.forQuery("shop", "SELECT * FROM t WHERE id = ?", List.of(2))).isNotEqualTo(key);
        assertThat(CacheKeys.forQuery("shop", "SELECT * FROM t WHERE id = ?", List.of("1"))).isNotEqualTo(key);
        assertThat(CacheKeys.forQuery("shop", "select * from t where id = ?", List.of(1))).isNotEqualTo(key);
    }
}
