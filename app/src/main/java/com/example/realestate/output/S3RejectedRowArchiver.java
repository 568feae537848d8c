package com.example.realestate.output;

import com.example.realestate.model.RawRow;
import com.example.realestate.model.RejectionReason;
import com.example.realestate.processor.RejectionListener;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Descarrega linhas rejeitadas para um bucket S3, quando {@code app.s3.rejected-rows-bucket-name} está configurado.
 * Falhas de arquivamento são apenas registradas em log e nunca interrompem o processamento.
 */
@Component
public class S3RejectedRowArchiver implements RejectionListener {

    private static final Logger log = LoggerFactory.getLogger(S3RejectedRowArchiver.class);

    private final S3Client s3Client;
    private final ObjectMapper objectMapper;
    private final String rejectedRowsBucketName;

    public S3RejectedRowArchiver(S3Client s3Client,
                                 ObjectMapper objectMapper,
                                 @Value("${app.s3.rejected-rows-bucket-name:}") String rejectedRowsBucketName) {
        this.s3Client = s3Client;
        this.objectMapper = objectMapper;
        this.rejectedRowsBucketName = rejectedRowsBucketName;
    }

    public boolean isEnabled() {
        return rejectedRowsBucketName != null && !rejectedRowsBucketName.isBlank();
    }

    /**
     * Salva a linha rejeitada como JSON em {@code rejected/<fonte>/<uuid>.json}, com o motivo da rejeição.
     */
    @Override
    public void onRejected(String sourceName, RawRow row, RejectionReason reason, String detail) {
        if (!isEnabled()) {
            return;
        }

        String objectKey = String.format("rejected/%s/%s.json", sourceName, UUID.randomUUID());
        try {
            Map<String, Object> rejectedData = new LinkedHashMap<>(row.asMap());
            rejectedData.put("_rejectionReason", reason.name());
            rejectedData.put("_rejectionDetail", detail);
            rejectedData.put("_sourceName", sourceName);
            rejectedData.put("_rejectionTimestamp", Instant.now().toString());

            String content = objectMapper.writeValueAsString(rejectedData);

            PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                    .bucket(rejectedRowsBucketName)
                    .key(objectKey)
                    .contentType("application/json")
                    .build();

            s3Client.putObject(putObjectRequest, RequestBody.fromString(content));

            log.debug("Linha rejeitada salva no S3: s3://{}/{}", rejectedRowsBucketName, objectKey);

        } catch (JsonProcessingException e) {
            log.error("Erro ao serializar linha rejeitada para JSON. Não foi possível salvar no S3. Registro: {}", row, e);
        } catch (Exception e) {
            log.error("Erro ao salvar linha rejeitada no S3 para o bucket {}. Registro: {}", rejectedRowsBucketName, row, e);
        }
    }
}
