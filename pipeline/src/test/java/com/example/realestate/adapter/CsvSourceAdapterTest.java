package com.example.realestate.adapter;

import com.example.realestate.config.FieldAliases;
import com.example.realestate.model.RawRow;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvSourceAdapterTest {

    private final CsvSourceAdapter adapter = new CsvSourceAdapter();

    @Test
    void readRows_parsesHeaderAndStripsBom() {
        String csv = "\uFEFF交易年月,單價,經度,緯度\n"
                + "112年01月,850000,121.5435,25.0267\n"
                + "\n"
                + "112年02月, 720000 ,121.5654,25.0330\n";

        List<RawRow> rows = adapter.readRows(new StringReader(csv));

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).getText("交易年月")).isEqualTo("112年01月");
        assertThat(rows.get(1).getText("單價")).isEqualTo("720000");
    }

    @Test
    void readRows_trailingDelimiterInHeader_ignoresUnnamedColumn() {
        String csv = "交易年月,單價,經度,緯度,\n"
                + "112年01月,850000,121.5435,25.0267,\n";

        List<RawRow> rows = adapter.readRows(new StringReader(csv));

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.keys()).containsExactly("交易年月", "單價", "經度", "緯度");
            assertThat(row.getText("單價")).isEqualTo("850000");
        });
    }

    @Test
    void readRows_customDelimiter() {
        List<RawRow> rows = new CsvSourceAdapter(';').readRows(new StringReader("price;yearMonth\n850000;2023-01\n"));

        assertThat(rows).singleElement().satisfies(row -> assertThat(row.getText("yearMonth")).isEqualTo("2023-01"));
    }

    @Test
    void readRows_malformedContent_isSourceFailure() {
        String csv = "price,yearMonth\n\"850000,2023-01\n";

        assertThatThrownBy(() -> adapter.readRows(new StringReader(csv)))
                .isInstanceOf(SourceLoadException.class);
    }

    @Test
    void readRows_duplicateHeader_isSourceFailure() {
        assertThatThrownBy(() -> adapter.readRows(new StringReader("price,price\n1,2\n")))
                .isInstanceOf(SourceLoadException.class);
    }

    @Test
    void resolveAddress_prefixesCityAndDistrict() {
        RawRow row = RawRow.of(Map.of("縣市", "臺北市", "鄉鎮市區", "大安區", "交易標的", "房地(土地+建物)"));

        assertThat(adapter.resolveAddress(row, FieldAliases.defaults())).contains("臺北市大安區房地(土地+建物)");
    }

    @Test
    void resolveAddress_doesNotRepeatPrefix() {
        RawRow row = RawRow.of(Map.of("縣市", "臺北市", "鄉鎮市區", "大安區", "土地位置建物門牌", "臺北市大安區和平東路二段1號"));

        assertThat(adapter.resolveAddress(row, FieldAliases.defaults())).contains("臺北市大安區和平東路二段1號");
    }

    @Test
    void resolveAddress_withoutLocationColumns_usesAliasesOnly() {
        assertThat(adapter.resolveAddress(RawRow.of(Map.of("address", "Rua A")), FieldAliases.defaults())).contains("Rua A");
        assertThat(adapter.resolveAddress(RawRow.of(Map.of()), FieldAliases.defaults())).isEmpty();
    }
}
