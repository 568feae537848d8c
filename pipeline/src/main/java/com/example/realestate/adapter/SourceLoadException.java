package com.example.realestate.adapter;

/**
 * Falha ao obter ou interpretar a sequência de linhas de uma fonte (arquivo, S3, banco de dados).
 * É fatal para a execução inteira: nenhum resultado parcial é devolvido.
 */
public class SourceLoadException extends RuntimeException {

    public SourceLoadException(String message) {
        super(message);
    }

    public SourceLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
