package com.example.realestate.geocoding;

import com.example.realestate.model.Coordinates;

/**
 * Serviço externo de geocodificação, consultado apenas quando a linha não traz nenhuma coordenada.
 * A chamada é síncrona, sem retry nem timeout próprios; uma falha descarta somente a linha em questão.
 */
@FunctionalInterface
public interface Geocoder {

    /**
     * @param address Endereço textual, nunca vazio.
     * @return As coordenadas encontradas.
     * @throws GeocodingException Se o endereço não puder ser resolvido.
     */
    Coordinates geocode(String address) throws GeocodingException;

    /**
     * Geocoder padrão, usado quando nenhum serviço foi configurado. Sempre falha.
     */
    static Geocoder unavailable() {
        return address -> {
            throw new GeocodingException("Nenhum serviço de geocodificação configurado para o endereço: " + address);
        };
    }
}
