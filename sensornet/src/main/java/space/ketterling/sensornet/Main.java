/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for the sensor network service.
*
* Initializes configuration, the metadata and observation connection pools,
* the metadata resolver, observation and aggregation services, the datadump
* export workers and their reaper, and starts the API server.
* program also handles a graceful shutdown.
*/

package space.ketterling.sensornet;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.sensornet.aggregate.AggregationEngine;
import space.ketterling.sensornet.api.ApiServer;
import space.ketterling.sensornet.api.InMemoryResponseCache;
import space.ketterling.sensornet.api.NoopResponseCache;
import space.ketterling.sensornet.api.RequestValidator;
import space.ketterling.sensornet.api.ResponseCache;
import space.ketterling.sensornet.config.AppConfig;
import space.ketterling.sensornet.db.Database;
import space.ketterling.sensornet.db.JdbcJobStore;
import space.ketterling.sensornet.export.ChunkedExportPipeline;
import space.ketterling.sensornet.export.DataDumpReaper;
import space.ketterling.sensornet.export.LocalExportJobQueue;
import space.ketterling.sensornet.format.ResultFormatter;
import space.ketterling.sensornet.meta.JdbcMetadataStore;
import space.ketterling.sensornet.meta.MetadataResolver;
import space.ketterling.sensornet.query.JdbcObservationStore;
import space.ketterling.sensornet.query.ObservationQueryBuilder;
import space.ketterling.sensornet.query.ObservationService;
import space.ketterling.sensornet.schema.JdbcSchemaRegistry;

import java.time.Clock;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();
        Clock clock = Clock.systemUTC();

        ObjectMapper om = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        HikariDataSource metaDs = Database.createMetadataDataSource(cfg);
        HikariDataSource obsDs = Database.createObservationDataSource(cfg);

        // Metadata + observation stores
        JdbcMetadataStore metadataStore = new JdbcMetadataStore(metaDs, om);
        MetadataResolver resolver = new MetadataResolver(metadataStore);
        JdbcSchemaRegistry schemas = new JdbcSchemaRegistry(obsDs);
        JdbcObservationStore observationStore = new JdbcObservationStore(obsDs, schemas);

        // Services
        ResultFormatter formatter = new ResultFormatter(om);
        ObservationService observations = new ObservationService(resolver, new ObservationQueryBuilder(schemas),
                observationStore, new AggregationEngine(schemas, observationStore), formatter);

        // Datadump exports
        JdbcJobStore jobStore = new JdbcJobStore(metaDs, om);
        ChunkedExportPipeline pipeline = new ChunkedExportPipeline(observations, observationStore, formatter,
                jobStore, jobStore, om, cfg.exportChunkSize(), cfg.cleanupSuppressTtlSeconds(), clock);
        LocalExportJobQueue exportQueue = new LocalExportJobQueue(pipeline, jobStore, om, cfg.exportWorkers(),
                cfg.workerId(), cfg.cleanupSuppressTtlSeconds(), clock);
        DataDumpReaper reaper = new DataDumpReaper(jobStore, jobStore, cfg.jobRetention(), cfg.reaperInterval(),
                clock);
        reaper.start();

        ResponseCache cache;
        if (cfg.cacheTtlSeconds() > 0) {
            cache = new InMemoryResponseCache(clock, cfg.cacheTtlSeconds(), cfg.cacheMaxEntries());
        } else {
            log.info("Response caching disabled by config");
            cache = new NoopResponseCache();
        }

        ApiServer api = new ApiServer(cfg, om, metaDs, resolver, observations, formatter,
                new RequestValidator(metadataStore, om, clock), exportQueue, jobStore, cache);
        api.start();
        log.info("API server started on port {}", cfg.apiPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                reaper.stop();
                exportQueue.stop();
                metaDs.close();
                obsDs.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }
}
