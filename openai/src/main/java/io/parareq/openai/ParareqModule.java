package io.parareq.openai;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.parareq.config.DispatchConfig;
import io.parareq.core.CostEstimator;
import io.parareq.core.RawJob;
import io.parareq.core.Source;
import io.parareq.core.Transport;
import io.parareq.runtime.AdmissionLoop;
import io.parareq.runtime.AdmissionLoopBuilder;
import io.parareq.sink.JsonLinesResultSink;
import io.parareq.sink.ResultSink;
import io.parareq.source.JsonLinesJobSource;

import java.io.IOException;
import java.net.URI;

public class ParareqModule extends AbstractModule {
    private final RunSettings settings;

    public ParareqModule(RunSettings settings) { this.settings = settings; }

    @Override
    protected void configure() {
        bind(RunSettings.class).toInstance(settings);
        bind(DispatchConfig.class).toInstance(settings.dispatch());
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton ObjectMapper objectMapper() { return new ObjectMapper(); }

    @Provides @Singleton CostEstimator costEstimator() {
        return CostEstimators.select(settings.costEstimator(), settings.requestUrl(), settings.tokenEncoding());
    }

    @Provides @Singleton Transport transport(ObjectMapper mapper) {
        var headers = new CredentialResolver().headers(settings.apiKey());
        return new HttpJsonTransport(URI.create(settings.requestUrl()), headers, settings.timeout(), mapper);
    }

    @Provides @Singleton Source<RawJob> source(ObjectMapper mapper) throws IOException {
        return new JsonLinesJobSource(settings.requestsFile(), mapper);
    }

    @Provides @Singleton ResultSink sink(ObjectMapper mapper) throws IOException {
        return new JsonLinesResultSink(settings.resultsFile(), mapper);
    }

    @Provides @Singleton AdmissionLoop admissionLoop(Source<RawJob> source, Transport transport, ResultSink sink,
                                                    CostEstimator estimator, DispatchConfig config, MetricRegistry registry) {
        return new AdmissionLoopBuilder()
                .source(source)
                .transport(transport)
                .sink(sink)
                .costEstimator(estimator)
                .config(config)
                .metrics(registry)
                .build();
    }
}
