package com.example.realestate.normalizer;

import com.example.realestate.model.RawRow;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FieldResolverTest {

    @Test
    void resolve_firstAliasInListWins() {
        RawRow row = RawRow.of(Map.of("單價", "850000", "price", "1"));

        assertThat(FieldResolver.resolve(row, List.of("單價", "price"))).contains("850000");
        assertThat(FieldResolver.resolve(row, List.of("price", "單價"))).contains("1");
    }

    @Test
    void resolve_skipsNullAndBlankValues() {
        Map<String, Object> values = new HashMap<>();
        values.put("交易年月", null);
        values.put("交易年月日", "  ");
        values.put("yearMonth", "2023-01");

        assertThat(FieldResolver.resolve(RawRow.of(values), List.of("交易年月", "交易年月日", "yearMonth"))).contains("2023-01");
    }

    @Test
    void resolve_absentIsDistinctFromZero() {
        RawRow row = RawRow.of(Map.of("area", 0));

        assertThat(FieldResolver.resolve(row, List.of("area"))).contains("0");
        assertThat(FieldResolver.resolve(row, List.of("totalPrice"))).isEmpty();
    }

    @Test
    void resolve_isCaseInsensitive_preferringExactKey() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("PRICE", "1");
        values.put("price", "2");

        assertThat(FieldResolver.resolve(RawRow.of(values), List.of("price"))).contains("2");
        assertThat(FieldResolver.resolve(RawRow.of(Map.of("Longitude", "121.5")), List.of("longitude"))).contains("121.5");
    }

    @Test
    void resolve_rendersNumbersAsPlainText() {
        RawRow row = RawRow.of(Map.of("total_price", new BigDecimal("2.4225E+7"), "lat", 25.0267));

        assertThat(FieldResolver.resolve(row, List.of("total_price"))).contains("24225000");
        assertThat(FieldResolver.resolve(row, List.of("lat"))).contains("25.0267");
    }

    @Test
    void resolve_emptyAliasList_isAbsent() {
        assertThat(FieldResolver.resolve(RawRow.of(Map.of("price", "1")), List.of())).isEmpty();
    }
}
