package com.example.realestate.loader;

import com.example.realestate.adapter.SourceLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class LocalFileLoader {

    private static final Logger log = LoggerFactory.getLogger(LocalFileLoader.class);

    /**
     * Lê o arquivo inteiro para memória.
     *
     * @param path Caminho do arquivo CSV ou JSON.
     * @param format Formato esperado do conteúdo.
     * @return O conteúdo carregado.
     * @throws SourceLoadException Se o arquivo não existir ou não puder ser lido.
     */
    public LoadedSource load(Path path, SourceFormat format) {
        log.info("Carregando arquivo {} local: {}", format, path);
        try {
            byte[] content = Files.readAllBytes(path);
            log.info("Arquivo '{}' carregado ({} bytes).", path.getFileName(), content.length);
            return LoadedSource.builder()
                    .name(String.valueOf(path.getFileName()))
                    .format(format)
                    .content(content)
                    .build();
        } catch (IOException e) {
            log.error("Erro de IO ao ler o arquivo '{}': {}", path, e.getMessage(), e);
            throw new SourceLoadException("Falha ao ler o arquivo " + path + ": " + e.getMessage(), e);
        }
    }
}
