package com.example.realestate.model;

import lombok.Value;

/**
 * Par de coordenadas em graus decimais.
 */
@Value(staticConstructor = "of")
public class Coordinates {
    double longitude;
    double latitude;
}
