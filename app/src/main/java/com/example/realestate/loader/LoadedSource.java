package com.example.realestate.loader;

import lombok.Builder;
import lombok.Value;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Conteúdo bruto já materializado de uma fonte de arquivo ou objeto, com o formato resolvido.
 */
@Value
@Builder
public class LoadedSource {

    String name;
    SourceFormat format;
    byte[] content;

    public InputStream openStream() {
        return new ByteArrayInputStream(content);
    }

    public Reader openReader() {
        return new InputStreamReader(openStream(), StandardCharsets.UTF_8);
    }
}
