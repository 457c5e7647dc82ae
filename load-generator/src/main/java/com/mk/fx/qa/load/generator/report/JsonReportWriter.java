package com.mk.fx.qa.load.generator.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.mk.fx.qa.load.generator.dto.SummaryReport;
import com.mk.fx.qa.load.generator.rest.JsonUtil;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes a {@link SummaryReport} as a JSON object indented with four spaces, {@code "key": value}
 * separators and {@code {}} / {@code []} for empty containers. Latencies are written in plain
 * decimal notation ({@code 0.0001}, not {@code 1.0E-4}).
 */
@Slf4j
public class JsonReportWriter {

  private final ObjectWriter writer =
      JsonUtil.mapper()
          .copy()
          .registerModule(
              new SimpleModule("report-decimals")
                  .addSerializer(Double.class, new PlainDecimalSerializer()))
          .writer(new ReportPrettyPrinter());

  public void write(SummaryReport report, Path output) throws IOException {
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(output, "output");
    Path parent = output.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    writer.writeValue(output.toFile(), report);
    log.info("Results written to {}", output);
  }

  public String toJson(SummaryReport report) throws IOException {
    return writer.writeValueAsString(report);
  }

  static final class ReportPrettyPrinter extends DefaultPrettyPrinter {

    private static final DefaultIndenter INDENTER = new DefaultIndenter("    ", "\n");

    ReportPrettyPrinter() {
      indentObjectsWith(INDENTER);
      indentArraysWith(INDENTER);
    }

    private ReportPrettyPrinter(ReportPrettyPrinter base) {
      super(base);
    }

    @Override
    public DefaultPrettyPrinter createInstance() {
      return new ReportPrettyPrinter(this);
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
      g.writeRaw(": ");
    }

    @Override
    public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
      if (!_objectIndenter.isInline()) {
        --_nesting;
      }
      if (nrOfEntries > 0) {
        _objectIndenter.writeIndentation(g, _nesting);
      }
      g.writeRaw('}');
    }

    @Override
    public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
      if (!_arrayIndenter.isInline()) {
        --_nesting;
      }
      if (nrOfValues > 0) {
        _arrayIndenter.writeIndentation(g, _nesting);
      }
      g.writeRaw(']');
    }
  }

  /** Writes a finite double without an exponent, keeping at least one fractional digit. */
  static final class PlainDecimalSerializer extends StdSerializer<Double> {

    PlainDecimalSerializer() {
      super(Double.class);
    }

    @Override
    public void serialize(Double value, JsonGenerator g, SerializerProvider provider)
        throws IOException {
      if (value.isNaN() || value.isInfinite()) {
        g.writeNumber(value.doubleValue());
        return;
      }
      BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
      if (decimal.scale() < 1) {
        decimal = decimal.setScale(1);
      }
      g.writeNumber(decimal.toPlainString());
    }
  }
}
