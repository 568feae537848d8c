package com.example.realestate.service;

import com.example.realestate.adapter.CsvSourceAdapter;
import com.example.realestate.adapter.DocumentSourceAdapter;
import com.example.realestate.adapter.RelationalSourceAdapter;
import com.example.realestate.config.PipelineOptions;
import com.example.realestate.config.PipelineProperties;
import com.example.realestate.geocoding.Geocoder;
import com.example.realestate.loader.DatabaseLoader;
import com.example.realestate.loader.LoadedSource;
import com.example.realestate.loader.LocalFileLoader;
import com.example.realestate.loader.S3ObjectLoader;
import com.example.realestate.loader.SourceFormat;
import com.example.realestate.model.PipelineResult;
import com.example.realestate.output.ProcessedDataWriter;
import com.example.realestate.output.S3RejectedRowArchiver;
import com.example.realestate.processor.RejectionListener;
import com.example.realestate.processor.TransactionPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Path;

/**
 * Carrega uma fonte (arquivo local, objeto S3 ou consulta relacional), normaliza as transações
 * pelo pipeline e publica o resultado.
 * Falhas de carregamento da fonte são propagadas; problemas em linhas individuais apenas são contados.
 */
@Service
public class TransactionIngestService {

    private static final Logger log = LoggerFactory.getLogger(TransactionIngestService.class);

    private final TransactionPipeline transactionPipeline;
    private final CsvSourceAdapter csvSourceAdapter;
    private final DocumentSourceAdapter documentSourceAdapter;
    private final RelationalSourceAdapter relationalSourceAdapter;
    private final LocalFileLoader localFileLoader;
    private final S3ObjectLoader s3ObjectLoader;
    private final DatabaseLoader databaseLoader;
    private final ProcessedDataWriter processedDataWriter;
    private final S3RejectedRowArchiver rejectedRowArchiver;
    private final PipelineProperties pipelineProperties;
    private final ObjectProvider<Geocoder> geocoderProvider;

    @Value("${app.output.path:./real-data.json}")
    private String outputPath;

    @Value("${app.output.s3-bucket-name:}")
    private String outputBucketName;

    @Value("${app.output.s3-key:processed/real-data.json}")
    private String outputKey;

    public TransactionIngestService(TransactionPipeline transactionPipeline,
                                    CsvSourceAdapter csvSourceAdapter,
                                    DocumentSourceAdapter documentSourceAdapter,
                                    RelationalSourceAdapter relationalSourceAdapter,
                                    LocalFileLoader localFileLoader,
                                    S3ObjectLoader s3ObjectLoader,
                                    DatabaseLoader databaseLoader,
                                    ProcessedDataWriter processedDataWriter,
                                    S3RejectedRowArchiver rejectedRowArchiver,
                                    PipelineProperties pipelineProperties,
                                    ObjectProvider<Geocoder> geocoderProvider) {
        this.transactionPipeline = transactionPipeline;
        this.csvSourceAdapter = csvSourceAdapter;
        this.documentSourceAdapter = documentSourceAdapter;
        this.relationalSourceAdapter = relationalSourceAdapter;
        this.localFileLoader = localFileLoader;
        this.s3ObjectLoader = s3ObjectLoader;
        this.databaseLoader = databaseLoader;
        this.processedDataWriter = processedDataWriter;
        this.rejectedRowArchiver = rejectedRowArchiver;
        this.pipelineProperties = pipelineProperties;
        this.geocoderProvider = geocoderProvider;
    }

    public PipelineResult ingestFile(Path path, SourceFormat format) throws IOException {
        return process(localFileLoader.load(path, format));
    }

    public PipelineResult ingestS3Object(String bucket, String key, SourceFormat format) throws IOException {
        return process(s3ObjectLoader.load(bucket, key, format));
    }

    public PipelineResult ingestDatabase(String sql) {
        return transactionPipeline.run(relationalSourceAdapter, databaseLoader.load(sql), buildOptions());
    }

    /**
     * Publica os registros aceitos no S3, se {@code app.output.s3-bucket-name} estiver configurado,
     * ou no arquivo local {@code app.output.path}.
     *
     * @param result O resultado de uma execução.
     * @throws IOException Se o destino não puder ser escrito.
     */
    public void publish(PipelineResult result) throws IOException {
        if (outputBucketName != null && !outputBucketName.isBlank()) {
            processedDataWriter.writeToS3(result.getRecords(), outputBucketName, outputKey);
        } else {
            processedDataWriter.writeToFile(result.getRecords(), Path.of(outputPath));
        }
    }

    private PipelineResult process(LoadedSource source) throws IOException {
        log.info("Processando a fonte '{}' no formato {}.", source.getName(), source.getFormat());
        if (source.getFormat() == SourceFormat.CSV) {
            try (Reader reader = source.openReader()) {
                return transactionPipeline.run(csvSourceAdapter, reader, buildOptions());
            }
        }
        try (InputStream inputStream = source.openStream()) {
            return transactionPipeline.run(documentSourceAdapter, inputStream, buildOptions());
        }
    }

    /**
     * Sem um bean {@link Geocoder} registrado, linhas sem coordenadas são descartadas.
     */
    PipelineOptions buildOptions() {
        RejectionListener rejectionListener = rejectedRowArchiver.isEnabled() ? rejectedRowArchiver : RejectionListener.NONE;
        return PipelineOptions.builder()
                .fieldMapping(pipelineProperties.getFieldMapping())
                .filter(pipelineProperties.toFilterCriteria())
                .geocoder(geocoderProvider.getIfAvailable(Geocoder::unavailable))
                .rejectionListener(rejectionListener)
                .build();
    }
}
