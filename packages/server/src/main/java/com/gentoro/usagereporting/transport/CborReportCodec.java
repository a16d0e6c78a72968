package com.gentoro.usagereporting.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.usagereporting.exception.EncodingException;
import com.gentoro.usagereporting.report.Report;
import com.gentoro.usagereporting.report.TracesAndStats;
import com.gentoro.usagereporting.trace.Trace;
import com.gentoro.usagereporting.utility.JacksonUtility;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/** CBOR encoding of reports. Traces inside a report are CBOR documents of their own. */
public class CborReportCodec implements ReportCodec {
  private final ObjectMapper cbor = JacksonUtility.getCborMapper();
  private final ObjectMapper json = JacksonUtility.getJsonMapper();

  @Override
  public void verify(Report report) {
    if (report.getHeader() == null) {
      throw new EncodingException("Error verifying report: header is missing");
    }
    if (isBlank(report.getHeader().getExecutableSchemaId())) {
      throw new EncodingException("Error verifying report: header.executableSchemaId is missing");
    }
    if (isBlank(report.getHeader().getGraphRef())) {
      throw new EncodingException("Error verifying report: header.graphRef is missing");
    }
    if (report.getOperationCount() < 0) {
      throw new EncodingException(
          "Error verifying report: operationCount is negative: " + report.getOperationCount());
    }
    for (Map.Entry<String, TracesAndStats> entry : report.getTracesPerQuery().entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        throw new EncodingException("Error verifying report: tracesPerQuery has a null entry");
      }
    }
  }

  @Override
  public byte[] encode(Report report) {
    try {
      return cbor.writeValueAsBytes(report);
    } catch (IOException e) {
      throw new EncodingException("Failed to encode report", e);
    }
  }

  @Override
  public Report decode(byte[] bytes) {
    try {
      return cbor.readValue(bytes, Report.class);
    } catch (IOException e) {
      throw new EncodingException("Failed to decode report", e);
    }
  }

  @Override
  public byte[] encodeTrace(Trace trace) {
    try {
      return cbor.writeValueAsBytes(trace);
    } catch (IOException e) {
      throw new EncodingException("Error encoding trace", e);
    }
  }

  @Override
  public Trace decodeTrace(byte[] bytes) {
    try {
      return cbor.readValue(bytes, Trace.class);
    } catch (IOException e) {
      throw new EncodingException("Failed to decode trace", e);
    }
  }

  @Override
  public String toDebugJson(byte[] encodedReport) {
    Report report = decode(encodedReport);
    ObjectNode tree = json.valueToTree(report);
    JsonNode perQuery = tree.path("tracesPerQuery");
    Iterator<Map.Entry<String, JsonNode>> fields = perQuery.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      ArrayNode traces = json.createArrayNode();
      for (byte[] encoded : report.getTracesPerQuery().get(field.getKey()).getTrace()) {
        traces.add(json.<JsonNode>valueToTree(decodeTrace(encoded)));
      }
      ((ObjectNode) field.getValue()).set("trace", traces);
    }
    return JacksonUtility.toJson(tree);
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
