package com.di.loannova.ingestion;

import com.di.loannova.common.Dataset;
import com.di.loannova.config.PipelineProperties;
import com.di.loannova.exception.PipelineException;
import com.di.loannova.observability.ObservabilityContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * BI-tool loan export (CSV) converted into canonical snapshot rows by {@link BiExportConverter}.
 */
@Slf4j
@Component
public class BiExportSourceAdapter implements SourceAdapter {

    private final TabularParser parser;
    private final BiExportConverter converter;
    private final CashBalanceLoader cashLoader;

    public BiExportSourceAdapter(TabularParser parser, Clock clock) {
        this.parser = parser;
        this.converter = new BiExportConverter(clock);
        this.cashLoader = new CashBalanceLoader(parser);
    }

    @Override
    public String type() {
        return "bi-export";
    }

    @Override
    public RawExtract fetch(PipelineProperties.Source source, ObservabilityContext ctx) {
        return FileSourceAdapter.readFile(type(), source.getPath(), ctx);
    }

    @Override
    public Dataset parse(RawExtract extract, PipelineProperties.Source source, ObservabilityContext ctx) {
        Dataset raw = parser.parse(extract.content(), TabularParser.Format.fromSuffix(extract.suffix()));
        Map<String, Double> cash = cashLoader.load(source.getFinancialsPath(),
                source.getFinancialsDateCandidates(), source.getFinancialsCashCandidates());

        BiExportConverter.Conversion conversion = converter.convert(raw, cash,
                source.getMeasurementDateColumn(), source.getMeasurementDateStrategy());
        if (conversion.dataset().isEmpty()) {
            throw new PipelineException("BI export conversion produced no rows (no parseable dates in " + extract.fileName() + ")");
        }
        log.info("[INGESTION] BI export recognised as {}: {} source row(s) -> {} snapshot(s), {} cash date(s)",
                conversion.sourceMode(), raw.size(), conversion.dataset().size(), cash.size());
        ctx.event("ingestion", "bi_export_converted", "success", Map.of(
                "source_mode", conversion.sourceMode(),
                "source_rows", raw.size(),
                "snapshots", conversion.dataset().size(),
                "cash_dates", cash.size()));
        return conversion.dataset();
    }
}
