package com.example.realestate.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Transação canônica pronta para agregação espaço-temporal e visualização.
 * Instâncias só são criadas pelo pipeline depois que todas as etapas de validação passaram.
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder({"position", "price", "yearMonth", "area", "address", "buildingType", "totalPrice"})
public class TransactionRecord {

    List<Double> position; // [longitude, latitude]
    double price;
    String yearMonth;
    @Builder.Default
    double area = 0;
    @Builder.Default
    String address = "";
    @Builder.Default
    String buildingType = "";
    @Builder.Default
    double totalPrice = 0;

    @JsonIgnore
    public double getLongitude() {
        return position.get(0);
    }

    @JsonIgnore
    public double getLatitude() {
        return position.get(1);
    }
}
