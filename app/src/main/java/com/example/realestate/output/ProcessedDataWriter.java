package com.example.realestate.output;

import com.example.realestate.model.TransactionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Publica as transações aceitas como array JSON para o consumidor de visualização.
 */
@Component
public class ProcessedDataWriter {

    private static final Logger log = LoggerFactory.getLogger(ProcessedDataWriter.class);

    private final ObjectMapper objectMapper;
    private final S3Client s3Client;

    public ProcessedDataWriter(ObjectMapper objectMapper, S3Client s3Client) {
        this.objectMapper = objectMapper;
        this.s3Client = s3Client;
    }

    /**
     * Grava os registros em um arquivo local, criando os diretórios necessários.
     *
     * @param records Os registros aceitos.
     * @param outputPath O caminho de destino; um arquivo existente é sobrescrito.
     * @throws IOException Se o arquivo não puder ser escrito.
     */
    public void writeToFile(List<TransactionRecord> records, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, serialize(records));
        log.info("Dados salvos em: {} ({} registros)", outputPath, records.size());
    }

    /**
     * Grava os registros como objeto JSON no S3.
     *
     * @param records Os registros aceitos.
     * @param bucket O bucket de destino.
     * @param key A chave do objeto.
     * @throws JsonProcessingException Se os registros não puderem ser serializados.
     */
    public void writeToS3(List<TransactionRecord> records, String bucket, String key) throws JsonProcessingException {
        PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType("application/json")
                .build();

        s3Client.putObject(putObjectRequest, RequestBody.fromString(serialize(records)));
        log.info("Dados salvos no S3: s3://{}/{} ({} registros)", bucket, key, records.size());
    }

    private String serialize(List<TransactionRecord> records) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(records);
    }
}
