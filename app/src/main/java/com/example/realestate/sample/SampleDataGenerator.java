package com.example.realestate.sample;

import com.example.realestate.model.TransactionRecord;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Gera transações fictícias de Taipei, de 2023-01 a 2024-12, para testar a visualização sem uma fonte real.
 * Cada distrito recebe entre 30 e 79 transações por mês, espalhadas em torno do seu ponto central.
 */
@Component
public class SampleDataGenerator {

    static final YearMonth FIRST_MONTH = YearMonth.of(2023, 1);
    static final YearMonth LAST_MONTH = YearMonth.of(2024, 12);
    static final String BUILDING_TYPE = "住宅大樓(11層含以上有電梯)";
    static final double MIN_PRICE = 300_000;

    static final List<District> DISTRICTS = List.of(
            new District("大安區", 121.5435, 25.0267, 800_000),
            new District("信義區", 121.5654, 25.0330, 750_000),
            new District("中正區", 121.5177, 25.0329, 600_000),
            new District("松山區", 121.5788, 25.0490, 600_000),
            new District("中山區", 121.5260, 25.0636, 600_000));

    private final Random random;

    public SampleDataGenerator() {
        this(new Random());
    }

    SampleDataGenerator(Random random) {
        this.random = random;
    }

    public List<TransactionRecord> generate() {
        List<TransactionRecord> records = new ArrayList<>();
        for (YearMonth month = FIRST_MONTH; !month.isAfter(LAST_MONTH); month = month.plusMonths(1)) {
            for (District district : DISTRICTS) {
                int transactions = 30 + random.nextInt(50);
                for (int i = 0; i < transactions; i++) {
                    records.add(sample(district, month));
                }
            }
        }
        return records;
    }

    private TransactionRecord sample(District district, YearMonth month) {
        double longitude = district.longitude + (random.nextDouble() - 0.5) * 0.02;
        double latitude = district.latitude + (random.nextDouble() - 0.5) * 0.02;
        double price = district.basePrice + (random.nextDouble() - 0.5) * 300_000;
        return TransactionRecord.builder()
                .position(List.of(longitude, latitude))
                .price(Math.max(MIN_PRICE, price))
                .yearMonth(month.toString())
                .area(20 + random.nextDouble() * 30)
                .address("台北市" + district.name)
                .buildingType(BUILDING_TYPE)
                .build();
    }

    static final class District {

        final String name;
        final double longitude;
        final double latitude;
        final double basePrice;

        District(String name, double longitude, double latitude, double basePrice) {
            this.name = name;
            this.longitude = longitude;
            this.latitude = latitude;
            this.basePrice = basePrice;
        }
    }
}
