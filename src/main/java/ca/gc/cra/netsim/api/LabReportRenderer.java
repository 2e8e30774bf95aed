package ca.gc.cra.netsim.api;

import ca.gc.cra.netsim.application.sim.LabReport;
import ca.gc.cra.netsim.domain.routing.Route;
import ca.gc.cra.netsim.domain.sim.SimulationEvent;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link LabReport} as console text or as a JSON document.
 */
final class LabReportRenderer {
  private static final JsonFactory JSON = new JsonFactory();

  private LabReportRenderer() {
    // Utility
  }

  static List<String> text(LabReport report) {
    List<String> lines = new ArrayList<>();
    lines.add(String.format(Locale.ROOT, "Lab: %d router(s), %d s simulated, %s", report.routerCount(),
        report.elapsedMillis() / 1000, report.converged() ? "converged" : "NOT converged"));
    lines.add("");
    lines.add("OSPF neighbors:");
    if (report.neighbors().isEmpty()) {
      lines.add("  (none)");
    }
    for (LabReport.NeighborRow row : report.neighbors()) {
      lines.add(String.format(Locale.ROOT, "  %-4s %-20s %-15s %-15s %s", row.router(), row.interfaceName(),
          row.neighborId(), row.address(), row.state()));
    }
    lines.add("");
    lines.add("Routing tables:");
    for (Map.Entry<String, List<Route>> table : report.routingTables().entrySet()) {
      lines.add("  " + table.getKey() + ":");
      for (Route route : table.getValue()) {
        lines.add("    " + route);
      }
    }
    lines.add("");
    lines.add("Ping " + report.ping().source() + " -> " + report.ping().destination() + ": "
        + report.ping().summary());
    lines.add("");
    lines.add("Events:");
    for (SimulationEvent event : report.events()) {
      lines.add(String.format(Locale.ROOT, "  [%9.3f] %-6s %-8s %s", event.timestampMillis() / 1000.0,
          event.device(), event.category(), event.message()));
    }
    return lines;
  }

  static String json(LabReport report) throws IOException {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = JSON.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeNumberField("routers", report.routerCount());
      gen.writeNumberField("elapsedMillis", report.elapsedMillis());
      gen.writeBooleanField("converged", report.converged());
      writeNeighbors(gen, report.neighbors());
      writeRoutes(gen, report.routingTables());
      writePing(gen, report.ping());
      writeEvents(gen, report.events());
      gen.writeEndObject();
    }
    return out.toString();
  }

  private static void writeNeighbors(JsonGenerator gen, List<LabReport.NeighborRow> rows) throws IOException {
    gen.writeArrayFieldStart("neighbors");
    for (LabReport.NeighborRow row : rows) {
      gen.writeStartObject();
      gen.writeStringField("router", row.router());
      gen.writeStringField("interface", row.interfaceName());
      gen.writeStringField("neighborId", row.neighborId().toString());
      gen.writeStringField("address", row.address().toString());
      gen.writeStringField("state", row.state().toString());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeRoutes(JsonGenerator gen, Map<String, List<Route>> tables) throws IOException {
    gen.writeObjectFieldStart("routingTables");
    for (Map.Entry<String, List<Route>> table : tables.entrySet()) {
      gen.writeArrayFieldStart(table.getKey());
      for (Route route : table.getValue()) {
        gen.writeStartObject();
        gen.writeStringField("source", route.source().name());
        gen.writeStringField("network", route.network() + "/" + route.mask().prefixLength());
        if (route.nextHop() != null) {
          gen.writeStringField("nextHop", route.nextHop().toString());
        }
        gen.writeStringField("interface", route.interfaceName());
        gen.writeNumberField("metric", route.metric());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    gen.writeEndObject();
  }

  private static void writePing(JsonGenerator gen, LabReport.PingOutcome ping) throws IOException {
    gen.writeObjectFieldStart("ping");
    gen.writeStringField("source", ping.source().toString());
    gen.writeStringField("destination", ping.destination().toString());
    gen.writeBooleanField("replied", ping.replied());
    if (ping.replied()) {
      gen.writeNumberField("replyTtl", ping.replyTtl());
    }
    if (ping.error() != null) {
      gen.writeStringField("error", ping.error().name());
    }
    gen.writeEndObject();
  }

  private static void writeEvents(JsonGenerator gen, List<SimulationEvent> events) throws IOException {
    gen.writeArrayFieldStart("events");
    for (SimulationEvent event : events) {
      gen.writeStartObject();
      gen.writeNumberField("timeMillis", event.timestampMillis());
      gen.writeStringField("device", event.device());
      gen.writeStringField("category", event.category());
      gen.writeStringField("message", event.message());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }
}
