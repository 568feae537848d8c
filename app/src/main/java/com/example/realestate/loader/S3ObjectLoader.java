package com.example.realestate.loader;

import com.example.realestate.adapter.SourceLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;

@Component
public class S3ObjectLoader {

    private static final Logger log = LoggerFactory.getLogger(S3ObjectLoader.class);

    private final S3Client s3Client;

    public S3ObjectLoader(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    /**
     * Baixa um objeto do S3. O formato é o informado explicitamente ou, na falta dele,
     * deduzido pelo content-type e pela extensão da chave.
     *
     * @param bucket Nome do bucket.
     * @param key Chave do objeto.
     * @param requestedFormat Formato explícito, ou {@code null} para detectar.
     * @return O conteúdo carregado.
     * @throws SourceLoadException Se o download falhar ou o formato não for suportado.
     */
    public LoadedSource load(String bucket, String key, SourceFormat requestedFormat) {
        log.info("Baixando objeto do S3: s3://{}/{}", bucket, key);
        ResponseBytes<GetObjectResponse> object;
        try {
            object = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
        } catch (SdkException e) {
            log.error("Erro ao baixar o objeto s3://{}/{}: {}", bucket, key, e.getMessage(), e);
            throw new SourceLoadException("Falha ao baixar s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }

        String contentType = object.response().contentType();
        SourceFormat format = requestedFormat != null ? requestedFormat : SourceFormat.detect(contentType, key)
                .orElseThrow(() -> new SourceLoadException("Formato de dados não suportado para s3://" + bucket + "/" + key + ": " + contentType));

        log.info("Objeto s3://{}/{} carregado ({} bytes, formato {}).", bucket, key, object.asByteArrayUnsafe().length, format);
        return LoadedSource.builder()
                .name(key)
                .format(format)
                .content(object.asByteArray())
                .build();
    }
}
