package com.example.realestate.runner;

import com.example.realestate.adapter.SourceLoadException;
import com.example.realestate.loader.DatabaseLoader;
import com.example.realestate.loader.SourceFormat;
import com.example.realestate.model.PipelineResult;
import com.example.realestate.model.TransactionRecord;
import com.example.realestate.output.ProcessedDataWriter;
import com.example.realestate.sample.SampleDataGenerator;
import com.example.realestate.service.TransactionIngestService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interpreta a linha de comando e dispara uma execução do pipeline.
 * <pre>
 *   csv  &lt;arquivo&gt;
 *   json &lt;arquivo&gt;
 *   s3   &lt;s3://bucket/chave | bucket chave&gt; [csv|json]
 *   db   [consulta SQL]
 *   sample [arquivo]
 * </pre>
 */
@Component
public class IngestCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IngestCommandRunner.class);

    static final String USAGE = "Uso:\n"
            + "  csv <arquivo>                               # carrega de um arquivo CSV\n"
            + "  json <arquivo>                              # carrega de um arquivo JSON\n"
            + "  s3 <s3://bucket/chave | bucket chave> [csv|json]  # carrega de um objeto S3\n"
            + "  db [consulta SQL]                           # carrega do banco de dados\n"
            + "  sample [arquivo]                            # gera dados de exemplo (padrão ./sample-data.json)";

    private static final String S3_SCHEME = "s3://";
    static final String DEFAULT_SAMPLE_PATH = "./sample-data.json";

    private final TransactionIngestService transactionIngestService;
    private final SampleDataGenerator sampleDataGenerator;
    private final ProcessedDataWriter processedDataWriter;

    public IngestCommandRunner(TransactionIngestService transactionIngestService,
                               SampleDataGenerator sampleDataGenerator,
                               ProcessedDataWriter processedDataWriter) {
        this.transactionIngestService = transactionIngestService;
        this.sampleDataGenerator = sampleDataGenerator;
        this.processedDataWriter = processedDataWriter;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> arguments = args.getNonOptionArgs();
        if (arguments.isEmpty()) {
            log.info(USAGE);
            return;
        }
        if ("sample".equals(arguments.get(0))) {
            writeSample(Path.of(arguments.size() > 1 ? arguments.get(1) : DEFAULT_SAMPLE_PATH));
            return;
        }

        PipelineResult result;
        try {
            result = dispatch(arguments.get(0), arguments.subList(1, arguments.size()));
        } catch (SourceLoadException e) {
            log.error("Falha ao carregar a fonte de dados: {}", e.getMessage());
            throw e;
        }
        if (result == null) {
            log.info(USAGE);
            return;
        }
        transactionIngestService.publish(result);
    }

    private void writeSample(Path path) throws IOException {
        List<TransactionRecord> records = sampleDataGenerator.generate();
        processedDataWriter.writeToFile(records, path);
        log.info("Dados de exemplo gerados: {} ({} registros)", path, records.size());
    }

    private PipelineResult dispatch(String command, List<String> params) throws IOException {
        switch (command) {
            case "csv":
                return params.isEmpty() ? null : transactionIngestService.ingestFile(Path.of(params.get(0)), SourceFormat.CSV);
            case "json":
                return params.isEmpty() ? null : transactionIngestService.ingestFile(Path.of(params.get(0)), SourceFormat.JSON);
            case "s3":
                return dispatchS3(params);
            case "db":
                return transactionIngestService.ingestDatabase(params.isEmpty() ? DatabaseLoader.DEFAULT_QUERY : String.join(" ", params));
            default:
                log.warn("Comando desconhecido: {}", command);
                return null;
        }
    }

    private PipelineResult dispatchS3(List<String> params) throws IOException {
        if (params.isEmpty()) {
            return null;
        }
        String bucket;
        String key;
        int next;
        if (params.get(0).startsWith(S3_SCHEME)) {
            String location = params.get(0).substring(S3_SCHEME.length());
            int slash = location.indexOf('/');
            if (slash <= 0 || slash == location.length() - 1) {
                log.warn("Endereço S3 inválido: {}", params.get(0));
                return null;
            }
            bucket = location.substring(0, slash);
            key = location.substring(slash + 1);
            next = 1;
        } else {
            if (params.size() < 2) {
                return null;
            }
            bucket = params.get(0);
            key = params.get(1);
            next = 2;
        }
        SourceFormat format = params.size() > next ? SourceFormat.fromName(params.get(next)).orElse(null) : null;
        return transactionIngestService.ingestS3Object(bucket, key, format);
    }
}
